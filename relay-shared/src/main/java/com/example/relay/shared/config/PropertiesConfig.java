package com.example.relay.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.relay.shared.repository")
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:relay-server-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "relay")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // relay.* is bound by @ConfigurationProperties; the pod name comes from the environment
        properties.setPodName(podName);
        return properties;
    }
}

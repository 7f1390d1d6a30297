package com.example.relay.shared;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boot configuration for slice tests of the shared module.
 */
@SpringBootApplication
public class SharedTestApplication {
}

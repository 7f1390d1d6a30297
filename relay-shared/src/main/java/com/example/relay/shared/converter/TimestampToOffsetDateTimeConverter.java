package com.example.relay.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Reads plain {@code TIMESTAMP} columns (e.g. from aggregate queries) as UTC
 * {@link OffsetDateTime} values.
 */
@ReadingConverter
public class TimestampToOffsetDateTimeConverter implements Converter<Timestamp, OffsetDateTime> {

    @Override
    public OffsetDateTime convert(Timestamp source) {
        return source == null ? null : source.toInstant().atOffset(ZoneOffset.UTC);
    }
}

package com.clickstream.analytics.parser;

import com.clickstream.analytics.domain.DomainModels;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

public final class TimestampParser {
    private static final DateTimeFormatter LENIENT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimestampParser() {}

    // null when blank or unrecognized
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            TemporalAccessor parsed = LENIENT.parseBest(raw.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
            if (parsed instanceof LocalDateTime ldt) return ldt.toInstant(DomainModels.EVENT_ZONE);
            return ((LocalDate) parsed).atStartOfDay(DomainModels.EVENT_ZONE).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}

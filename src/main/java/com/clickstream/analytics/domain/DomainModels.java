package com.clickstream.analytics.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

public class DomainModels {
    public static final ZoneOffset EVENT_ZONE = ZoneOffset.UTC;

    public record Event(String userId,
                        String sessionId,
                        Instant timestamp,
                        String action,
                        Double value,
                        String category,
                        LocalDate date) {
        public Event {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(action, "action");
        }

        public static Event of(String userId, String sessionId, Instant timestamp, String action, Double value, String category) {
            return new Event(userId, sessionId, timestamp, action, value, category, toDate(timestamp));
        }

        public static Event of(String userId, String sessionId, Instant timestamp, String action) {
            return of(userId, sessionId, timestamp, action, null, FieldNames.UNKNOWN_CATEGORY);
        }

        public boolean hasTimestamp() {
            return timestamp != null;
        }
    }

    public record FieldNames(String session,
                             String user,
                             String timestamp,
                             String action,
                             String value,
                             String category) {
        public static final String UNKNOWN_CATEGORY = "unknown";

        public static FieldNames defaults() {
            return new FieldNames("sessionid", "userid", "timestamp", "action", "value", "category");
        }

        public List<String> all() {
            return List.of(session, user, timestamp, action, value, category);
        }
    }

    public static LocalDate toDate(Instant timestamp) {
        return timestamp == null ? null : LocalDate.ofInstant(timestamp, EVENT_ZONE);
    }
}

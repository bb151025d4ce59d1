package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.domain.exception.HealthStoreException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** ISO-8601 event timestamp ayrıştırma; sondaki 'Z' önce +00:00'a çevrilir. */
public final class EventTimestamps {

    private static final String UTC_OFFSET = "+00:00";

    private EventTimestamps() {
    }

    /** Geçersiz değer için INVALID_TIMESTAMP fırlatır. */
    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw HealthStoreException.invalidTimestamp(String.valueOf(value), null);
        }
        try {
            return OffsetDateTime.parse(normalize(value.trim()), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw HealthStoreException.invalidTimestamp(value, e);
        }
    }

    /** Okuma tarafı sıralaması için; ayrıştırılamayan değerde null döner. */
    public static OffsetDateTime parseOrNull(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(normalize(value.toString().trim()), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String normalize(String value) {
        if (value.endsWith("Z") || value.endsWith("z")) {
            return value.substring(0, value.length() - 1) + UTC_OFFSET;
        }
        return value;
    }
}

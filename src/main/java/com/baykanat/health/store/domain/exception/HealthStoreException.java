package com.baykanat.health.store.domain.exception;

import lombok.Getter;

/** Domain hatası; ErrorCode + okunabilir sebep. I/O hataları cause olarak taşınır, retry yapılmaz. */
@Getter
public class HealthStoreException extends RuntimeException {

    private final ErrorCode code;

    public HealthStoreException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HealthStoreException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static HealthStoreException malformedDate(String value) {
        return new HealthStoreException(ErrorCode.MALFORMED_DATE,
                "Malformed date '" + value + "', expected YYYY-MM-DD");
    }

    public static HealthStoreException invalidTimestamp(String value, Throwable cause) {
        return new HealthStoreException(ErrorCode.INVALID_TIMESTAMP,
                "Invalid timestamp '" + value + "', expected ISO-8601 with offset or 'Z'", cause);
    }

    public static HealthStoreException invalidDateFormat(String value) {
        return new HealthStoreException(ErrorCode.INVALID_DATE_FORMAT,
                "Invalid date format '" + value + "', expected YYYY-MM-DD");
    }

    public static HealthStoreException partitionNotFound(String date) {
        return new HealthStoreException(ErrorCode.PARTITION_NOT_FOUND,
                "Partition not found for date " + date);
    }
}

package com.baykanat.health.store.domain.exception;

/** Store ve sorgu katmanının hata sınıfları; HTTP eşlemesi GlobalExceptionHandler'da. */
public enum ErrorCode {

    MALFORMED_DATE,
    INVALID_TIMESTAMP,
    STORAGE_WRITE_FAILED,
    PARTITION_READ_FAILED,
    INVENTORY_READ_FAILED,
    QUERY_EXECUTION_FAILED,
    INVALID_DATE_FORMAT,
    PARTITION_NOT_FOUND,
    UNKNOWN_TOOL,
    INVALID_TOOL_ARGUMENTS
}

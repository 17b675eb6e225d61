package io.riskwatch.ingestion.api.exception;

public enum ErrorCategory {
    TIMEOUT(true),              // Connection/read timeout
    CONNECTION_REFUSED(true),   // Connection refused
    DNS_ERROR(false),           // Unknown host
    NETWORK_ERROR(true),        // Other network issues
    IO_ERROR(true),             // I/O problems
    INVALID_URL(false),         // Malformed URL
    NOT_FOUND(false),           // 404
    ACCESS_FORBIDDEN(false),    // 403
    AUTH_REQUIRED(false),       // 401
    SERVER_ERROR(true),         // 500
    SERVER_UNAVAILABLE(true),   // 502, 503, 504
    HTTP_ERROR(false),          // Other 4xx
    PARSE_ERROR(false),         // XML/RSS parsing issues
    RATE_LIMITED(true),         // 429
    UNKNOWN(false);

    private final boolean transientFailure;

    ErrorCategory(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

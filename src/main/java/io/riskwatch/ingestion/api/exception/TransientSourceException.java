package io.riskwatch.ingestion.api.exception;

public class TransientSourceException extends SourceFetchException {

    public TransientSourceException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}

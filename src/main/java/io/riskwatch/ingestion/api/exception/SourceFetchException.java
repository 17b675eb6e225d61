package io.riskwatch.ingestion.api.exception;

/**
 * A source could not be fetched or parsed. The category decides whether a retry makes sense.
 */
public class SourceFetchException extends Exception {

    private final ErrorCategory category;

    public SourceFetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public SourceFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public static SourceFetchException of(String message, Throwable cause, ErrorCategory category) {
        return category.isTransient()
                ? new TransientSourceException(message, cause, category)
                : new SourceFetchException(message, cause, category);
    }

    public static SourceFetchException of(String message, ErrorCategory category) {
        return of(message, null, category);
    }
}

package org.nowstart.tidepy.data.exception;

import lombok.Getter;
import org.nowstart.tidepy.data.type.ErrorCategory;

/**
 * Failure reported by an exchange adapter, already classified as transient or terminal.
 */
@Getter
public class ExchangeException extends RuntimeException {

    private final ErrorCategory category;

    public ExchangeException(ErrorCategory category, String message) {
        this(category, message, null);
    }

    public ExchangeException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        if (category != ErrorCategory.EXCHANGE_TRANSIENT && category != ErrorCategory.EXCHANGE_TERMINAL) {
            throw new IllegalArgumentException("exchange failures must be EXCHANGE_TRANSIENT or EXCHANGE_TERMINAL");
        }
        this.category = category;
    }

    public static ExchangeException transientFailure(String message, Throwable cause) {
        return new ExchangeException(ErrorCategory.EXCHANGE_TRANSIENT, message, cause);
    }

    public static ExchangeException terminalFailure(String message, Throwable cause) {
        return new ExchangeException(ErrorCategory.EXCHANGE_TERMINAL, message, cause);
    }

    public boolean isTransient() {
        return category == ErrorCategory.EXCHANGE_TRANSIENT;
    }
}

package org.nowstart.tidepy.service.execution;

import feign.FeignException;
import feign.RetryableException;
import org.nowstart.tidepy.data.exception.ExchangeException;

/**
 * Maps REST client failures onto the transient/terminal split. Connection problems, 5xx, 429 and the 418
 * IP ban are worth retrying; any other 4xx means the request itself was refused.
 */
public final class ExchangeFailureClassifier {

    private ExchangeFailureClassifier() {
    }

    public static ExchangeException classify(String action, RuntimeException exception) {
        if (exception instanceof ExchangeException exchangeException) {
            return exchangeException;
        }
        if (exception instanceof RetryableException) {
            return ExchangeException.transientFailure(action + " failed: " + exception.getMessage(), exception);
        }
        if (exception instanceof FeignException feignException) {
            int status = feignException.status();
            String detail = action + " failed with status " + status + ": " + extractDetail(feignException);
            if (isTransientStatus(status)) {
                return ExchangeException.transientFailure(detail, exception);
            }
            return ExchangeException.terminalFailure(detail, exception);
        }
        return ExchangeException.terminalFailure(action + " failed: " + exception.getMessage(), exception);
    }

    static boolean isTransientStatus(int status) {
        return status < 0 || status >= 500 || status == 429 || status == 418;
    }

    private static String extractDetail(FeignException exception) {
        String body = exception.contentUTF8();
        if (body != null && !body.isBlank()) {
            return body;
        }
        String message = exception.getMessage();
        return message == null ? "no detail" : message;
    }
}

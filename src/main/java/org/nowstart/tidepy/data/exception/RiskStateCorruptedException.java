package org.nowstart.tidepy.data.exception;

public class RiskStateCorruptedException extends RuntimeException {

    public RiskStateCorruptedException(String message) {
        super(message);
    }
}

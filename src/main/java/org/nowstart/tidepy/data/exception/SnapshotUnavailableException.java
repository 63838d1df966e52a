package org.nowstart.tidepy.data.exception;

public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

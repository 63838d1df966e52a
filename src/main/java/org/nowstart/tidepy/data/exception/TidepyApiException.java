package org.nowstart.tidepy.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class TidepyApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public TidepyApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}

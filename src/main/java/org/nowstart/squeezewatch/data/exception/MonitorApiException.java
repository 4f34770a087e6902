package org.nowstart.squeezewatch.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class MonitorApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public MonitorApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}

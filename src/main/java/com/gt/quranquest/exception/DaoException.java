package com.gt.quranquest.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the verse learning state store cannot be read or written. Never retried by the engine.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class DaoException extends RuntimeException {

    public DaoException(String errMsg)  {
        super(errMsg);
    }

    public DaoException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}

package com.gt.quranquest.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a lesson operation is requested while no lesson is in progress
@ResponseStatus(value = HttpStatus.CONFLICT)
public class LessonNotStartedException extends RuntimeException {

    public LessonNotStartedException(String msg) {
        super(msg);
    }

    public LessonNotStartedException(String msg, Exception ex) {
        super(msg, ex);
    }
}

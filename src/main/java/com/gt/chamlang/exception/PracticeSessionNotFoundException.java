package com.gt.chamlang.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class PracticeSessionNotFoundException extends RuntimeException {

    public PracticeSessionNotFoundException(String sessionId) {
        super("No active practice session with id " + sessionId);
    }
}

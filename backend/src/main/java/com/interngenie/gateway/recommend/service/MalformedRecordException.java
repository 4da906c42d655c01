package com.interngenie.gateway.recommend.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A stored profile or posting holds values the scorer cannot accept, such as negative experience.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class MalformedRecordException extends RuntimeException {
    public MalformedRecordException(String message) {
        super(message);
    }
}

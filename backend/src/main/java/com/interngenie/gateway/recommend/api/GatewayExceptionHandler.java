package com.interngenie.gateway.recommend.api;

import com.interngenie.gateway.recommend.service.MalformedRecordException;
import com.interngenie.gateway.recommend.service.ProfileNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GatewayExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleProfileNotFound(ProfileNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "profile_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(MalformedRecordException.class)
    public ResponseEntity<Map<String, String>> handleMalformedRecord(MalformedRecordException ex) {
        log.error("Rejected ranking pass over malformed data: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(Map.of("error", "malformed_record", "message", ex.getMessage()));
    }
}

package com.distributedsystems.bhr.controller;

import com.distributedsystems.bhr.exception.BhrException;
import com.distributedsystems.bhr.exception.BlockStillActiveException;
import com.distributedsystems.bhr.exception.NoSuchActiveBlockException;
import com.distributedsystems.bhr.exception.NoSuchBlockException;
import com.distributedsystems.bhr.exception.NoSuchWhitelistEntryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps registry failures onto distinct responses: malformed input and whitelist
 * conflicts are both 400 but carry different error codes, unknown or no-longer-live
 * blocks are 404.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(BhrException.class)
    public ResponseEntity<Map<String, Object>> handleRegistryError(BhrException ex) {
        HttpStatus status = statusFor(ex);
        log.warn("[api] {} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        return new ResponseEntity<>(body(ex.getCode(), ex.getMessage()), status);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(body("invalid_request", "request body could not be read"), HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusFor(BhrException ex) {
        if (ex instanceof NoSuchActiveBlockException
                || ex instanceof NoSuchBlockException
                || ex instanceof NoSuchWhitelistEntryException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof BlockStillActiveException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}

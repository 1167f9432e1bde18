package com.exposureplatform.exposure.controller;

import com.exposureplatform.common.exception.ExposureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        log.info("Request rejected. reason={}", ex.getMessage());
        return Map.of(
                "code", "INVALID_REQUEST",
                "message", String.valueOf(ex.getMessage())
        );
    }

    @ExceptionHandler(ExposureException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleExposureFailure(ExposureException ex) {
        log.error("Exposure processing failed. store={}", ex.getStore(), ex);
        return Map.of(
                "code", ex.affectsStatus() ? "STATUS_UNAVAILABLE" : "EXPOSURE_FAILURE",
                "component", ex.getStore().label(),
                "message", String.valueOf(ex.getMessage())
        );
    }
}

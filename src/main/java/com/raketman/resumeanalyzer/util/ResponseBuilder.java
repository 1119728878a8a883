package com.raketman.resumeanalyzer.util;

import com.raketman.resumeanalyzer.dto.ServiceResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class ResponseBuilder {

    private ResponseBuilder() {
    }

    public static <T> ResponseEntity<ServiceResponse<T>> error(
            String message,
            String errorCode,
            HttpStatus status,
            String path
    ) {
        return ResponseEntity.status(status).body(ServiceResponse.error(message, errorCode, path));
    }
}

package com.raketman.resumeanalyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceResponse<T> {
    private boolean success;
    private String message;
    private String errorCode;
    private String path;
    private LocalDateTime timestamp;
    private T data;

    public ServiceResponse(boolean success, String message, T data) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.timestamp = LocalDateTime.now();
    }

    public static <T> ServiceResponse<T> error(String message, String errorCode, String path) {
        return new ServiceResponse<>(
                false,
                message,
                errorCode,
                path,
                LocalDateTime.now(),
                null
        );
    }
}

package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AiConnectionStatus {

    boolean valid;
    String message;

    public static AiConnectionStatus valid(String message) {
        return AiConnectionStatus.builder().valid(true).message(message).build();
    }

    public static AiConnectionStatus invalid(String message) {
        return AiConnectionStatus.builder().valid(false).message(message).build();
    }
}

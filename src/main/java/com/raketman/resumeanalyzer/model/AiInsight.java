package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AiInsight {

    public enum Status {
        GENERATED,
        UNAVAILABLE,
        DISABLED
    }

    Status status;
    String text;
    String message;

    public static AiInsight generated(String text) {
        return AiInsight.builder().status(Status.GENERATED).text(text).build();
    }

    public static AiInsight unavailable(String reason) {
        return AiInsight.builder()
                .status(Status.UNAVAILABLE)
                .message("AI insight unavailable: " + reason)
                .build();
    }

    public static AiInsight disabled() {
        return AiInsight.builder()
                .status(Status.DISABLED)
                .message("AI insight unavailable: no AI provider configured")
                .build();
    }
}

package com.raketman.resumeanalyzer.exception;

public class AiNarrativeException extends RuntimeException {
    public AiNarrativeException(String message) {
        super(message);
    }

    public AiNarrativeException(String message, Throwable cause) {
        super(message, cause);
    }
}

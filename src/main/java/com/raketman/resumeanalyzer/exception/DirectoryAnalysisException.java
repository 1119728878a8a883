package com.raketman.resumeanalyzer.exception;

import lombok.Getter;

@Getter
public class DirectoryAnalysisException extends RuntimeException {
    private final String directory;

    public DirectoryAnalysisException(String directory, String message) {
        super(message);
        this.directory = directory;
    }

    public DirectoryAnalysisException(String directory, String message, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }
}

package com.raketman.resumeanalyzer.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class UnknownRoleException extends RuntimeException {
    private final List<String> roleNames;

    public UnknownRoleException(List<String> roleNames) {
        super("Unknown role(s): " + String.join(", ", roleNames));
        this.roleNames = roleNames;
    }
}

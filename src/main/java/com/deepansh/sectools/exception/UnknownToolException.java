package com.deepansh.sectools.exception;

import lombok.Getter;

import java.util.Collection;

@Getter
public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName, Collection<String> available) {
        super(String.format("Unknown tool '%s'. Available tools: %s", toolName, available));
        this.toolName = toolName;
    }
}

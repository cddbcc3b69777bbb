package com.z254.vigil.warden.tool;

import lombok.Getter;

/**
 * A tool threw, timed out or reported failure.
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private final String toolName;
    private final String errorCode;

    public ToolExecutionException(String toolName, String errorCode, String message) {
        super(message);
        this.toolName = toolName;
        this.errorCode = errorCode;
    }

    public ToolExecutionException(String toolName, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.errorCode = errorCode;
    }
}

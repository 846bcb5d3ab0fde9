package com.politest.exception;

import java.nio.file.Path;

/**
 * A policy or test input the user has to fix: unreadable file, invalid JSON, bad test case.
 */
public class PolicyLoadException extends RuntimeException {

    private final String filePath;

    public PolicyLoadException(String message) {
        super(message);
        this.filePath = null;
    }

    public PolicyLoadException(Path file, String message, Throwable cause) {
        super(message + ": " + file, cause);
        this.filePath = file.toString();
    }

    public PolicyLoadException(Path file, String message) {
        super(message + ": " + file);
        this.filePath = file.toString();
    }

    public String getFilePath() {
        return filePath;
    }
}

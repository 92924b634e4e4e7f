package com.batchbridge.infrastructure.dropzone;

public class DropLocationException extends RuntimeException {

    public DropLocationException(String message, Throwable cause) {
        super(message, cause);
    }
}

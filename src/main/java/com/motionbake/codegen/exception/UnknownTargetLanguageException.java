package com.motionbake.codegen.exception;

public class UnknownTargetLanguageException extends RuntimeException {

    public UnknownTargetLanguageException(String message) {
        super(message);
    }
}

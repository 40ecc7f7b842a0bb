package com.autonomous.crew.sandbox;

public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }
}

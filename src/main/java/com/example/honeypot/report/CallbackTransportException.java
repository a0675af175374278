package com.example.honeypot.report;

public class CallbackTransportException extends RuntimeException {

    public CallbackTransportException(String message) {
        super(message);
    }

    public CallbackTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

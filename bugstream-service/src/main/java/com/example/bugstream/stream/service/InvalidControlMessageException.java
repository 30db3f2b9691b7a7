package com.example.bugstream.stream.service;

public class InvalidControlMessageException extends RuntimeException {

    public InvalidControlMessageException(String message) {
        super(message);
    }

    public InvalidControlMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

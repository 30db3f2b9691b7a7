package com.example.bugstream.stream.transport;

public class StreamTransportException extends RuntimeException {

    public StreamTransportException(String message) {
        super(message);
    }

    public StreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.bugstream.stream.transport;

/**
 * A message-oriented client link. Implementations must tolerate {@link #send} and
 * {@link #close} being called from different threads.
 */
public interface StreamTransport {

    boolean isOpen();

    /**
     * Writes one text frame.
     *
     * @throws StreamTransportException if the frame could not be queued for writing
     */
    void send(String payload);

    void close(int code, String reason);
}

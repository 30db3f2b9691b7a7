package com.example.bugstream.stream.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges a reactive {@link WebSocketSession} to the push-style {@link StreamTransport}.
 * Outbound frames go through a unicast sink that {@link #outbound()} drains into the session.
 */
@Slf4j
public class WebSocketSessionTransport implements StreamTransport {

    private final WebSocketSession session;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketSessionTransport(WebSocketSession session) {
        this.session = session;
    }

    public Mono<Void> outbound() {
        return session.send(sink.asFlux().map(session::textMessage));
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    @Override
    public synchronized void send(String payload) {
        Sinks.EmitResult result = sink.tryEmitNext(payload);
        if (result.isFailure()) {
            throw new StreamTransportException("Failed to queue frame for session " + session.getId() + ": " + result);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            sink.tryEmitComplete();
        }
        session.close(new CloseStatus(code, reason))
                .subscribe(
                        unused -> { },
                        error -> log.debug("Close of session {} failed: {}", session.getId(), error.getMessage()));
    }
}

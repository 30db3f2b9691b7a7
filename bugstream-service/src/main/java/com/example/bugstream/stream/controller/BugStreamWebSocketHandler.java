package com.example.bugstream.stream.controller;

import com.example.bugstream.shared.util.Constants;
import com.example.bugstream.shared.util.Constants.CloseCodes;
import com.example.bugstream.stream.model.ConnectionMetadata;
import com.example.bugstream.stream.service.ConnectionRegistry;
import com.example.bugstream.stream.service.ControlMessageHandler;
import com.example.bugstream.stream.transport.WebSocketSessionTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * WebSocket endpoint for live bug streams. Each session becomes one registered connection whose
 * inbound frames are control messages and whose outbound frames are stream messages.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BugStreamWebSocketHandler implements WebSocketHandler {

    private final ConnectionRegistry connectionRegistry;
    private final ControlMessageHandler controlMessageHandler;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        WebSocketSessionTransport transport = new WebSocketSessionTransport(session);

        return connectionRegistry.accept(transport, resolveToken(handshake), metadataOf(handshake))
                .flatMap(accepted -> {
                    if (accepted.isEmpty()) {
                        // already closed with 1013
                        return Mono.<Void>empty();
                    }
                    String connectionId = accepted.get().getId();

                    Mono<Void> inbound = session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .concatMap(payload -> controlMessageHandler.handle(connectionId, payload))
                            .doOnError(error -> connectionRegistry.handleTransportError(connectionId, error))
                            .onErrorResume(error -> Mono.empty())
                            .doFinally(signal -> connectionRegistry.close(connectionId,
                                    CloseCodes.NORMAL, "Connection closed by client"))
                            .then();

                    Mono<Void> outbound = transport.outbound()
                            .onErrorResume(error -> {
                                connectionRegistry.handleTransportError(connectionId, error);
                                return Mono.empty();
                            });

                    return Mono.when(inbound, outbound);
                });
    }

    /**
     * Token from the {@code token} query parameter, else the Authorization header.
     */
    static String resolveToken(HandshakeInfo handshake) {
        String fromQuery = UriComponentsBuilder.fromUri(handshake.getUri())
                .build()
                .getQueryParams()
                .getFirst(Constants.TOKEN_QUERY_PARAM);
        if (StringUtils.hasText(fromQuery)) {
            return URLDecoder.decode(fromQuery, StandardCharsets.UTF_8);
        }

        String header = handshake.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(header)) {
            return null;
        }
        return header.startsWith(Constants.BEARER_PREFIX)
                ? header.substring(Constants.BEARER_PREFIX.length()).trim()
                : header.trim();
    }

    private static ConnectionMetadata metadataOf(HandshakeInfo handshake) {
        InetSocketAddress remote = handshake.getRemoteAddress();
        String ip = remote != null && remote.getAddress() != null
                ? remote.getAddress().getHostAddress()
                : "unknown";
        String userAgent = handshake.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        return new ConnectionMetadata(ip, userAgent != null ? userAgent : "unknown", "websocket");
    }
}

package com.example.bugstream.stream.config;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.stream.controller.BugStreamWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Map;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebFluxConfigurer {

    private final AppProperties appProperties;

    @Bean
    public HandlerMapping bugStreamHandlerMapping(BugStreamWebSocketHandler handler) {
        String path = appProperties.getStream().getPath();
        log.info("Mapping bug stream WebSocket endpoint at {}", path);
        return new SimpleUrlHandlerMapping(Map.of(path, handler), -1);
    }

    /**
     * Frames above the configured payload size are refused by Reactor Netty before they reach the handler.
     */
    @Override
    public WebSocketService getWebSocketService() {
        int maxPayload = appProperties.getStream().getMaxPayloadBytes();
        return new HandshakeWebSocketService(new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxPayload)));
    }
}

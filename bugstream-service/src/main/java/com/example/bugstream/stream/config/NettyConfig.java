package com.example.bugstream.stream.config;

import com.example.bugstream.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.embedded.netty.NettyReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.LoopResources;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class NettyConfig {

    private final AppProperties appProperties;

    @Bean
    public WebServerFactoryCustomizer<NettyReactiveWebServerFactory> bugStreamNettyCustomizer() {
        return factory -> {
            String threadPrefix = appProperties.getService().getName() + "-io";
            LoopResources loopResources = LoopResources.create(threadPrefix, LoopResources.DEFAULT_IO_WORKER_COUNT, true);
            factory.addServerCustomizers(server -> server.runOn(loopResources));
            log.info("Netty event loops named '{}' with {} workers", threadPrefix, LoopResources.DEFAULT_IO_WORKER_COUNT);
        };
    }
}

package com.example.bugstream.stream.service;

import com.example.bugstream.shared.config.AppProperties;
import com.example.bugstream.shared.util.Constants.CloseCodes;
import com.example.bugstream.stream.model.StreamConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Heartbeats live connections and evicts the ones idle for more than two heartbeat periods.
 * An evicted connection gets no heartbeat in the same pass.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LivenessMonitor {

    private final ConnectionRegistry connectionRegistry;
    private final StreamMessageFactory messageFactory;
    private final AppProperties appProperties;
    private final Clock clock;

    public record LivenessPass(int heartbeats, int evicted) {}

    public LivenessPass runPass() {
        Instant now = Instant.now(clock);
        Instant staleThreshold = now.minusMillis(appProperties.getStream().getHeartbeatInterval() * 2);

        int heartbeats = 0;
        int evicted = 0;
        for (StreamConnection connection : connectionRegistry.connections()) {
            if (connection.getLastActivity().isBefore(staleThreshold)) {
                log.warn("Connection {} stale since {}. Evicting.", connection.getId(), connection.getLastActivity());
                if (connectionRegistry.close(connection.getId(), CloseCodes.NORMAL, CloseCodes.REASON_TIMEOUT)) {
                    evicted++;
                }
            } else if (connection.isOpen()
                    && connectionRegistry.send(connection, messageFactory.createHeartbeat())) {
                heartbeats++;
            }
        }

        if (evicted > 0) {
            log.info("Liveness pass: {} heartbeats sent, {} stale connections evicted", heartbeats, evicted);
        } else {
            log.debug("Liveness pass: {} heartbeats sent", heartbeats);
        }
        return new LivenessPass(heartbeats, evicted);
    }
}

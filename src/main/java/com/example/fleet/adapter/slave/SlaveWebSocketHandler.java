package com.example.fleet.adapter.slave;

import com.example.fleet.config.FleetProperties;
import com.example.fleet.core.slave.SlaveIdentity;
import com.example.fleet.core.slave.SlaveLink;
import com.example.fleet.core.slave.SlaveLinkServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Binds one authenticated WebSocket session to the {@link SlaveLinkServer}.
 * Inbound frames are handled in arrival order off the event loop.
 */
@Slf4j
@Component
public class SlaveWebSocketHandler implements WebSocketHandler {
    private final SlaveLinkServer server;
    private final int outboundBuffer;
    private final Duration writeTimeout;

    public SlaveWebSocketHandler(SlaveLinkServer server, FleetProperties props) {
        this.server = server;
        this.outboundBuffer = props.getLink().getOutboundBuffer();
        this.writeTimeout = props.getLink().getWriteTimeout();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Object attribute = session.getAttributes().get(SlaveIdentityFilter.IDENTITY_ATTRIBUTE);
        if (!(attribute instanceof SlaveIdentity identity)) {
            log.warn("Slave session {} has no authenticated identity, closing", session.getId());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        WebSocketSlaveTransport transport = new WebSocketSlaveTransport(session, outboundBuffer, writeTimeout);
        SlaveLink link = new SlaveLink(identity, transport);
        log.info("Slave link opened: host={}, session={}", identity.hostId(), session.getId());

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(frame -> server.onFrame(link, frame))
                .doOnError(e -> log.warn("Slave link {} read failed: {}", identity.hostId(), e.getMessage()))
                .doFinally(signal -> {
                    transport.close();
                    server.onClosed(link);
                    log.info("Slave link closed: host={}, session={} ({})", identity.hostId(), session.getId(), signal);
                })
                .then();
        Mono<Void> output = session.send(transport.outbound().map(session::textMessage));
        return Mono.when(input, output);
    }
}

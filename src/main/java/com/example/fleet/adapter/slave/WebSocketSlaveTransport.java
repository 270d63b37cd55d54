package com.example.fleet.adapter.slave;

import com.example.fleet.core.slave.SlaveTransport;
import com.example.fleet.core.slave.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * {@link SlaveTransport} over a reactive WebSocket session. Frames are handed to a
 * bounded buffer drained by {@code session.send}; a writer waits at most the write
 * timeout for room in the buffer.
 */
@Slf4j
class WebSocketSlaveTransport implements SlaveTransport {
    private final WebSocketSession session;
    private final Sinks.Many<String> outbound;
    private final Duration writeTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    WebSocketSlaveTransport(WebSocketSession session, int bufferSize, Duration writeTimeout) {
        this.session = session;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
        this.writeTimeout = writeTimeout;
    }

    Flux<String> outbound() {
        return outbound.asFlux();
    }

    @Override
    public void send(String frame) {
        long deadline = System.nanoTime() + writeTimeout.toNanos();
        while (true) {
            if (closed.get()) {
                throw new TransportException("link closed");
            }
            Sinks.EmitResult result = outbound.tryEmitNext(frame);
            if (result.isSuccess()) {
                return;
            }
            if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
                throw new TransportException("link closed");
            }
            if (System.nanoTime() - deadline > 0) {
                throw new TransportException("write timed out after " + writeTimeout.toMillis() + "ms (" + result + ")");
            }
            // overflow or a concurrent emitter; retry shortly
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        outbound.tryEmitComplete();
        session.close().subscribe(null, e -> log.debug("Close of session {} failed: {}", session.getId(), e.getMessage()));
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }
}

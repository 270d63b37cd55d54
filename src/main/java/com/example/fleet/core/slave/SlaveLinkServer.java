package com.example.fleet.core.slave;

import com.example.fleet.core.protocol.Message;
import com.example.fleet.core.protocol.MessageCodec;
import com.example.fleet.core.protocol.MessageType;
import com.example.fleet.core.protocol.ProtocolException;
import com.example.fleet.core.protocol.SlaveMessages;
import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.ToolCallException;
import com.example.fleet.core.proxy.ToolProxy;
import com.example.fleet.core.store.ContextStore;
import com.example.fleet.core.store.SlaveStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Protocol side of the slave links: decodes inbound frames into registry calls,
 * correlates replies with outstanding tool calls, and executes master tools on
 * behalf of slaves. Transport-agnostic; the WebSocket adapter feeds it frames.
 */
@Slf4j
public class SlaveLinkServer {
    private final SlaveRegistry registry;
    private final ToolProxy toolProxy;
    private final ContextStore contextStore;
    private final SlaveStore store;
    private final PairingService pairing;
    private final MessageCodec codec;
    private final Executor masterToolExecutor;
    private final Duration toolCallTimeout;

    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final AtomicLong callSequence = new AtomicLong();

    private record PendingCall(String hostId, SlaveTransport transport, CompletableFuture<Message> reply) {}

    public SlaveLinkServer(SlaveRegistry registry, ToolProxy toolProxy, ContextStore contextStore,
                           SlaveStore store, PairingService pairing, MessageCodec codec,
                           Executor masterToolExecutor, Duration toolCallTimeout) {
        this.registry = registry;
        this.toolProxy = toolProxy;
        this.contextStore = contextStore;
        this.store = store;
        this.pairing = pairing;
        this.codec = codec;
        this.masterToolExecutor = masterToolExecutor;
        this.toolCallTimeout = toolCallTimeout;
    }

    public void onFrame(SlaveLink link, String frame) {
        Message msg;
        try {
            msg = codec.decode(frame).receivedAt(Instant.now());
        } catch (ProtocolException e) {
            log.warn("Dropping frame from slave {}: {}", link.getHostId(), e.getMessage());
            sendError(link, null, e.getMessage());
            return;
        }

        try {
            switch (msg.type()) {
                case REGISTER -> handleRegister(link, msg);
                case HEARTBEAT -> registry.updateHeartbeat(link.getHostId());
                case TOOL_UPDATE -> handleToolUpdate(link, msg);
                case RESPONSE, ERROR -> completePendingCall(link, msg);
                case MASTER_TOOL_CALL -> handleMasterToolCall(link, msg);
                default -> {
                    log.warn("Unexpected {} message from slave {}", msg.type().wireName(), link.getHostId());
                    sendError(link, msg.id(), "unexpected message type: " + msg.type().wireName());
                }
            }
        } catch (SlaveNotConnectedException e) {
            log.warn("Slave {} sent {} before registering", link.getHostId(), msg.type().wireName());
            sendError(link, msg.id(), e.getMessage());
        } catch (ProtocolException e) {
            log.warn("Invalid {} message from slave {}: {}", msg.type().wireName(), link.getHostId(), e.getMessage());
            sendError(link, msg.id(), e.getMessage());
        }
    }

    /**
     * The read side of {@code link} ended. Removes its registry entry unless a newer
     * link for the same host has superseded it, and fails calls waiting on it.
     */
    public void onClosed(SlaveLink link) {
        registry.unregisterTransport(link.getHostId(), link.getTransport());
        failPendingCalls(link.getTransport(), "link closed");
    }

    private void handleRegister(SlaveLink link, Message msg) {
        SlaveMessages.Register reg = codec.payload(msg, SlaveMessages.Register.class);
        if (reg.hostname() != null && !reg.hostname().isBlank() && !reg.hostname().equals(link.getHostId())) {
            log.warn("Slave {} tried to register as {}", link.getHostId(), reg.hostname());
            sendError(link, msg.id(), "hostname does not match certificate");
            return;
        }
        // the credential may have been revoked since the handshake
        PairingService.Verdict verdict = verifyCredential(link);
        if (verdict != PairingService.Verdict.ACCEPTED) {
            log.warn("Refusing registration of slave {}: credential {}", link.getHostId(),
                    verdict == null ? "check failed" : verdict);
            sendError(link, msg.id(), "credential rejected");
            link.getTransport().close();
            return;
        }

        log.info("Slave registered: host={}, version={}, tools={}",
                link.getHostId(), reg.version(), reg.tools().size());
        registry.register(link.getHostId(), link.getTransport(), link.getIdentity().certSerial(), reg.tools());

        if (reg.version() != null) {
            try {
                store.updateSlaveVersion(link.getHostId(), reg.version());
            } catch (DataAccessException e) {
                log.warn("Failed to record version for slave {}", link.getHostId(), e);
            }
        }

        trySend(link.getTransport(), link.getHostId(),
                Message.of(MessageType.RESPONSE, msg.id(), codec.toData(SlaveMessages.RegisterAck.REGISTERED)));
        pushMasterTools(link.getHostId());
    }

    private PairingService.Verdict verifyCredential(SlaveLink link) {
        try {
            return pairing.verify(link.getIdentity());
        } catch (DataAccessException e) {
            log.warn("Failed to verify credential of slave {}", link.getHostId(), e);
            return null;
        }
    }

    private void handleToolUpdate(SlaveLink link, Message msg) {
        if (msg.data() == null || !msg.data().isArray()) {
            throw new ProtocolException("tool_update payload must be a tool array");
        }
        List<JsonNode> tools = new ArrayList<>();
        msg.data().forEach(tools::add);
        registry.updateTools(link.getHostId(), tools);
        log.info("Slave tools updated: host={}, tools={}", link.getHostId(), tools.size());
    }

    private void completePendingCall(SlaveLink link, Message msg) {
        PendingCall call = msg.id() == null ? null : pendingCalls.get(msg.id());
        if (call == null || !call.hostId().equals(link.getHostId())) {
            log.debug("Discarding uncorrelated {} from slave {} (id {})",
                    msg.type().wireName(), link.getHostId(), msg.id());
            return;
        }
        call.reply().complete(msg);
    }

    private void handleMasterToolCall(SlaveLink link, Message msg) {
        if (msg.id() == null) {
            throw new ProtocolException("master_tool_call requires an id");
        }
        if (!isRegisteredLink(link)) {
            throw new SlaveNotConnectedException(link.getHostId());
        }
        SlaveMessages.MasterToolCall call = codec.payload(msg, SlaveMessages.MasterToolCall.class);
        try {
            masterToolExecutor.execute(() -> {
                SlaveMessages.ToolCallResponse response = executeMasterTool(link.getHostId(), call);
                trySend(link.getTransport(), link.getHostId(),
                        Message.of(MessageType.RESPONSE, msg.id(), codec.toData(response)));
            });
        } catch (RejectedExecutionException e) {
            log.warn("Master tool call from slave {} rejected: executor saturated", link.getHostId());
            sendError(link, msg.id(), "master busy");
        }
    }

    private boolean isRegisteredLink(SlaveLink link) {
        return registry.getConnection(link.getHostId())
                .map(c -> c.getTransport() == link.getTransport())
                .orElse(false);
    }

    SlaveMessages.ToolCallResponse executeMasterTool(String hostId, SlaveMessages.MasterToolCall call) {
        ProxyClient client = toolProxy.getClient(call.server())
                .filter(c -> !c.isRemote() && toolProxy.isClientEnabled(c.getName()))
                .orElse(null);
        if (client == null) {
            return SlaveMessages.ToolCallResponse.failed("unknown master server: " + call.server());
        }
        log.info("Slave {} calling master tool {}/{}", hostId, call.server(), call.tool());
        try {
            return SlaveMessages.ToolCallResponse.ok(client.callTool(call.tool(), call.arguments()));
        } catch (RuntimeException e) {
            log.warn("Master tool {}/{} failed for slave {}: {}", call.server(), call.tool(), hostId, e.getMessage());
            return SlaveMessages.ToolCallResponse.failed(e.getMessage());
        }
    }

    /**
     * Sends a {@code tool_call} to the slave and blocks until the correlated reply
     * arrives or the call times out.
     *
     * @throws SlaveNotConnectedException if no live link exists for the host
     * @throws ToolCallException          on timeout, link failure or a slave-reported error
     */
    public JsonNode sendToolCall(String hostId, String tool, JsonNode arguments) {
        SlaveConnection connection = registry.getConnection(hostId)
                .orElseThrow(() -> new SlaveNotConnectedException(hostId));

        String callId = hostId + "-" + callSequence.incrementAndGet();
        PendingCall call = new PendingCall(hostId, connection.getTransport(), new CompletableFuture<>());
        pendingCalls.put(callId, call);
        try {
            JsonNode data = codec.toData(new SlaveMessages.ToolCall(tool, arguments));
            send(connection.getTransport(), Message.of(MessageType.TOOL_CALL, callId, data));
            return interpretReply(call.reply().get(toolCallTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            throw new ToolCallException("tool call timed out after " + toolCallTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolCallException("tool call interrupted");
        } catch (ExecutionException e) {
            throw new ToolCallException("tool call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TransportException e) {
            throw new ToolCallException("failed to send tool call: " + e.getMessage(), e);
        } finally {
            pendingCalls.remove(callId);
        }
    }

    private JsonNode interpretReply(Message reply) {
        if (reply.type() == MessageType.ERROR) {
            JsonNode data = reply.data();
            String error = data != null && data.hasNonNull("error") ? data.get("error").asText() : String.valueOf(data);
            throw new ToolCallException("tool call failed: " + error);
        }
        SlaveMessages.ToolCallResponse response;
        try {
            response = codec.payload(reply, SlaveMessages.ToolCallResponse.class);
        } catch (ProtocolException e) {
            throw new ToolCallException("failed to decode tool response", e);
        }
        if (response.error() != null && !response.error().isEmpty()) {
            throw new ToolCallException("tool execution error: " + response.error());
        }
        return response.result() == null ? NullNode.getInstance() : response.result();
    }

    public void sendRestart(String hostId) {
        sendControl(hostId, MessageType.RESTART);
    }

    public void sendUpgrade(String hostId) {
        sendControl(hostId, MessageType.UPGRADE);
    }

    private void sendControl(String hostId, MessageType type) {
        SlaveConnection connection = registry.getConnection(hostId)
                .orElseThrow(() -> new SlaveNotConnectedException(hostId));
        send(connection.getTransport(), Message.control(type));
        log.info("Sent {} command to slave {}", type.wireName(), hostId);
    }

    public void pushMasterTools(String hostId) {
        registry.getConnection(hostId).ifPresent(connection ->
                trySend(connection.getTransport(), hostId,
                        Message.of(MessageType.MASTER_TOOLS, null, codec.toData(buildMasterTools()))));
    }

    public void broadcastMasterTools() {
        List<SlaveConnection> slaves = registry.getConnectedSlaves();
        if (slaves.isEmpty()) {
            return;
        }
        JsonNode data = codec.toData(buildMasterTools());
        for (SlaveConnection connection : slaves) {
            trySend(connection.getTransport(), connection.getHostId(), Message.of(MessageType.MASTER_TOOLS, null, data));
        }
        log.info("Pushed master tools to {} slaves", slaves.size());
    }

    SlaveMessages.MasterTools buildMasterTools() {
        Map<String, List<JsonNode>> servers = new LinkedHashMap<>();
        for (ProxyClient client : toolProxy.getLocalClients()) {
            if (!toolProxy.isClientEnabled(client.getName())) {
                continue;
            }
            try {
                servers.put(client.getName(), client.listTools());
            } catch (RuntimeException e) {
                log.warn("Failed to list tools of master server {}", client.getName(), e);
            }
        }
        Map<String, List<String>> contexts;
        try {
            contexts = contextStore.contextServerMappings();
        } catch (DataAccessException e) {
            log.warn("Failed to load context mappings", e);
            contexts = Map.of();
        }
        return new SlaveMessages.MasterTools(servers, contexts);
    }

    /**
     * Closes every live link and fails all outstanding tool calls.
     */
    public void stop() {
        for (SlaveConnection connection : registry.getConnectedSlaves()) {
            connection.getTransport().close();
        }
        pendingCalls.values().forEach(c ->
                c.reply().completeExceptionally(new TransportException("link server stopped")));
        log.info("Slave link server stopped");
    }

    public int pendingCallCount() {
        return pendingCalls.size();
    }

    private void failPendingCalls(SlaveTransport transport, String reason) {
        pendingCalls.values().stream()
                .filter(c -> c.transport() == transport)
                .forEach(c -> c.reply().completeExceptionally(new TransportException(reason)));
    }

    private void send(SlaveTransport transport, Message msg) {
        transport.send(codec.encode(msg));
    }

    private void trySend(SlaveTransport transport, String hostId, Message msg) {
        try {
            send(transport, msg);
        } catch (TransportException e) {
            log.warn("Failed to send {} to slave {}: {}", msg.type().wireName(), hostId, e.getMessage());
        }
    }

    private void sendError(SlaveLink link, String id, String error) {
        trySend(link.getTransport(), link.getHostId(),
                Message.of(MessageType.ERROR, id, codec.toData(new SlaveMessages.ErrorPayload(error))));
    }
}

package com.example.fleet.core.slave;

import com.example.fleet.core.protocol.Message;
import com.example.fleet.core.protocol.MessageCodec;
import com.example.fleet.core.protocol.MessageType;
import com.example.fleet.core.protocol.SlaveMessages;
import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.RoutingToolProxy;
import com.example.fleet.core.proxy.ToolCallException;
import com.example.fleet.core.store.ContextStore;
import com.example.fleet.core.store.SlaveStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SlaveLinkServerTest {
    private final MessageCodec codec = new MessageCodec();

    private SlaveStore store;
    private PairingService pairing;
    private ContextStore contextStore;
    private SlaveRegistry registry;
    private RoutingToolProxy proxy;
    private SlaveLinkServer server;

    @BeforeEach
    void setUp() {
        store = mock(SlaveStore.class);
        pairing = mock(PairingService.class);
        when(pairing.verify(any())).thenReturn(PairingService.Verdict.ACCEPTED);
        contextStore = mock(ContextStore.class);
        when(contextStore.contextServerMappings()).thenReturn(Map.of());
        registry = new SlaveRegistry(store, new SimpleMeterRegistry(), new MutableClock(Instant.parse("2024-05-01T10:00:00Z")),
                Duration.ofMinutes(2), Duration.ofSeconds(30), 100);
        proxy = new RoutingToolProxy();
        server = newServer(Runnable::run, Duration.ofMillis(300));
    }

    private SlaveLinkServer newServer(Executor executor, Duration timeout) {
        return new SlaveLinkServer(registry, proxy, contextStore, store, pairing, codec, executor, timeout);
    }

    @Test
    void testRegister_acknowledgesAndPushesMasterTools() throws Exception {
        SlaveLink link = link("alpha");

        server.onFrame(link, "{\"type\":\"register\",\"id\":\"r1\",\"data\":"
                + "{\"hostname\":\"alpha\",\"version\":\"1.2.0\",\"tools\":[{\"name\":\"echo\"}]}}");

        assertTrue(registry.isConnected("alpha"));
        assertEquals("ab12", registry.getConnection("alpha").orElseThrow().getCertSerial());
        Message ack = next(link);
        assertEquals(MessageType.RESPONSE, ack.type());
        assertEquals("r1", ack.id());
        assertEquals("registered", ack.data().get("status").asText());
        assertEquals(MessageType.MASTER_TOOLS, next(link).type());
        verify(store).updateSlaveVersion("alpha", "1.2.0");
    }

    @Test
    void testRegister_versionStoreFailureStillRegisters() throws Exception {
        doThrow(new DataAccessResourceFailureException("db down")).when(store).updateSlaveVersion(any(), any());
        SlaveLink link = link("alpha");

        server.onFrame(link, registerFrame("alpha"));

        assertTrue(registry.isConnected("alpha"));
        assertEquals(MessageType.RESPONSE, next(link).type());
    }

    @Test
    void testRegister_hostnameMismatchIsRejected() throws Exception {
        SlaveLink link = link("alpha");

        server.onFrame(link, registerFrame("beta"));

        assertFalse(registry.isConnected("alpha"));
        assertFalse(registry.isConnected("beta"));
        Message error = next(link);
        assertEquals(MessageType.ERROR, error.type());
        assertEquals("hostname does not match certificate", error.data().get("error").asText());
    }

    @Test
    void testRegister_revokedCredentialIsRefused() throws Exception {
        when(pairing.verify(any())).thenReturn(PairingService.Verdict.REVOKED);
        SlaveLink link = link("alpha");

        server.onFrame(link, registerFrame("alpha"));

        Message error = next(link);
        assertEquals(MessageType.ERROR, error.type());
        assertEquals("credential rejected", error.data().get("error").asText());
        assertTrue(((RecordingTransport) link.getTransport()).isClosed());
        assertFalse(registry.isConnected("alpha"));
    }

    @Test
    void testRegister_credentialCheckFailureIsRefused() throws Exception {
        when(pairing.verify(any())).thenThrow(new DataAccessResourceFailureException("db down"));
        SlaveLink link = link("alpha");

        server.onFrame(link, registerFrame("alpha"));

        assertEquals(MessageType.ERROR, next(link).type());
        assertTrue(((RecordingTransport) link.getTransport()).isClosed());
        assertFalse(registry.isConnected("alpha"));
    }

    @Test
    void testHeartbeatBeforeRegister_repliesWithError() throws Exception {
        SlaveLink link = link("alpha");

        server.onFrame(link, "{\"type\":\"heartbeat\"}");

        Message error = next(link);
        assertEquals(MessageType.ERROR, error.type());
        assertEquals("slave alpha not connected", error.data().get("error").asText());
    }

    @Test
    void testMalformedAndUnknownFrames_replyWithError() throws Exception {
        SlaveLink link = link("alpha");

        server.onFrame(link, "not json");
        server.onFrame(link, "{\"type\":\"bogus\"}");

        assertEquals(MessageType.ERROR, next(link).type());
        assertEquals("Unknown message type: bogus", next(link).data().get("error").asText());
    }

    @Test
    void testToolUpdate_replacesAdvertisedTools() throws Exception {
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"tool_update\",\"data\":[{\"name\":\"a\"},{\"name\":\"b\"}]}");

        assertEquals(2, registry.getConnection("alpha").orElseThrow().getToolCount());
    }

    @Test
    void testToolUpdate_nonArrayPayloadIsRejected() throws Exception {
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"tool_update\",\"data\":{\"name\":\"a\"}}");

        assertEquals(MessageType.ERROR, next(link).type());
        assertEquals(0, registry.getConnection("alpha").orElseThrow().getToolCount());
    }

    @Test
    void testSendToolCall_returnsCorrelatedResult() throws Exception {
        SlaveLink link = registered("alpha");

        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", codec.toData(Map.of("text", "hi"))));
        Message call = next(link);
        assertEquals(MessageType.TOOL_CALL, call.type());
        assertTrue(call.id().startsWith("alpha-"));
        assertEquals("echo", call.data().get("tool").asText());
        assertEquals("hi", call.data().get("arguments").get("text").asText());

        server.onFrame(link, "{\"type\":\"response\",\"id\":\"" + call.id() + "\",\"data\":"
                + "{\"success\":true,\"result\":{\"text\":\"hi\"}}}");

        assertEquals("hi", result.get(2, TimeUnit.SECONDS).get("text").asText());
        assertEquals(0, server.pendingCallCount());
    }

    @Test
    void testSendToolCall_slaveReportedErrorFails() throws Exception {
        SlaveLink link = registered("alpha");

        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", null));
        Message call = next(link);
        server.onFrame(link, "{\"type\":\"response\",\"id\":\"" + call.id() + "\",\"data\":"
                + "{\"success\":false,\"error\":\"boom\"}}");

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ToolCallException.class, e.getCause());
        assertEquals("tool execution error: boom", e.getCause().getMessage());
    }

    @Test
    void testSendToolCall_errorFrameFails() throws Exception {
        SlaveLink link = registered("alpha");

        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", null));
        Message call = next(link);
        server.onFrame(link, "{\"type\":\"error\",\"id\":\"" + call.id() + "\",\"data\":{\"error\":\"no such tool\"}}");

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertEquals("tool call failed: no such tool", e.getCause().getMessage());
    }

    @Test
    void testSendToolCall_timesOutAndDiscardsLateReply() throws Exception {
        SlaveLink link = registered("alpha");

        ToolCallException e = assertThrows(ToolCallException.class, () -> server.sendToolCall("alpha", "slow", null));
        assertTrue(e.getMessage().startsWith("tool call timed out"));
        assertEquals(0, server.pendingCallCount());

        Message call = next(link);
        server.onFrame(link, "{\"type\":\"response\",\"id\":\"" + call.id() + "\",\"data\":{\"success\":true}}");
        assertEquals(0, ((RecordingTransport) link.getTransport()).pendingFrames());
    }

    @Test
    void testSendToolCall_replyFromAnotherHostIsIgnored() throws Exception {
        SlaveLink alpha = registered("alpha");
        SlaveLink beta = registered("beta");

        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", null));
        Message call = next(alpha);
        server.onFrame(beta, "{\"type\":\"response\",\"id\":\"" + call.id() + "\",\"data\":{\"success\":true}}");

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertTrue(e.getCause().getMessage().startsWith("tool call timed out"));
    }

    @Test
    void testSendToolCall_notConnectedHost() {
        assertThrows(SlaveNotConnectedException.class, () -> server.sendToolCall("ghost", "echo", null));
    }

    @Test
    void testSendToolCall_transportFailure() throws Exception {
        SlaveLink link = registered("alpha");
        ((RecordingTransport) link.getTransport()).failSends();

        ToolCallException e = assertThrows(ToolCallException.class, () -> server.sendToolCall("alpha", "echo", null));
        assertTrue(e.getMessage().startsWith("failed to send tool call"));
        assertEquals(0, server.pendingCallCount());
    }

    @Test
    void testOnClosed_unregistersAndFailsPendingCalls() throws Exception {
        server = newServer(Runnable::run, Duration.ofSeconds(10));
        SlaveLink link = registered("alpha");

        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", null));
        next(link);
        server.onClosed(link);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertEquals("tool call failed: link closed", e.getCause().getMessage());
        assertFalse(registry.isConnected("alpha"));
    }

    @Test
    void testOnClosed_supersededLinkKeepsSuccessor() throws Exception {
        SlaveLink first = registered("alpha");
        SlaveLink second = registered("alpha");

        server.onClosed(first);

        assertTrue(registry.isConnected("alpha"));
        assertSame(second.getTransport(), registry.getConnection("alpha").orElseThrow().getTransport());
    }

    @Test
    void testMasterToolCall_executesLocalTool() throws Exception {
        ProxyClient files = localClient("files");
        when(files.callTool(eq("read"), any())).thenReturn(TextNode.valueOf("contents"));
        proxy.registerLocalClient(files);
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"master_tool_call\",\"id\":\"m1\",\"data\":"
                + "{\"server\":\"files\",\"tool\":\"read\",\"arguments\":{\"path\":\"/tmp/x\"}}}");

        Message reply = next(link);
        assertEquals(MessageType.RESPONSE, reply.type());
        assertEquals("m1", reply.id());
        assertTrue(reply.data().get("success").asBoolean());
        assertEquals("contents", reply.data().get("result").asText());
    }

    @Test
    void testMasterToolCall_unknownOrDisabledServerFails() throws Exception {
        proxy.registerLocalClient(localClient("files"));
        proxy.setClientEnabled("files", false);
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"master_tool_call\",\"id\":\"m1\",\"data\":{\"server\":\"files\",\"tool\":\"read\"}}");
        server.onFrame(link, "{\"type\":\"master_tool_call\",\"id\":\"m2\",\"data\":{\"server\":\"nope\",\"tool\":\"read\"}}");

        Message first = next(link);
        assertFalse(first.data().get("success").asBoolean());
        assertEquals("unknown master server: files", first.data().get("error").asText());
        assertEquals("unknown master server: nope", next(link).data().get("error").asText());
    }

    @Test
    void testMasterToolCall_unregisteredLinkIsRejected() throws Exception {
        ProxyClient files = localClient("files");
        proxy.registerLocalClient(files);
        registered("alpha");
        SlaveLink sideLink = link("alpha");
        SlaveLink neverRegistered = link("beta");

        server.onFrame(sideLink, "{\"type\":\"master_tool_call\",\"id\":\"m1\",\"data\":{\"server\":\"files\",\"tool\":\"read\"}}");
        server.onFrame(neverRegistered, "{\"type\":\"master_tool_call\",\"id\":\"m2\",\"data\":{\"server\":\"files\",\"tool\":\"read\"}}");

        assertEquals(MessageType.ERROR, next(sideLink).type());
        assertEquals(MessageType.ERROR, next(neverRegistered).type());
        verify(files, never()).callTool(any(), any());
    }

    @Test
    void testMasterToolCall_withoutIdIsRejected() throws Exception {
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"master_tool_call\",\"data\":{\"server\":\"files\",\"tool\":\"read\"}}");

        assertEquals(MessageType.ERROR, next(link).type());
    }

    @Test
    void testMasterToolCall_saturatedExecutorRepliesBusy() throws Exception {
        server = newServer(r -> {
            throw new RejectedExecutionException("full");
        }, Duration.ofMillis(300));
        SlaveLink link = registered("alpha");

        server.onFrame(link, "{\"type\":\"master_tool_call\",\"id\":\"m1\",\"data\":{\"server\":\"files\",\"tool\":\"read\"}}");

        Message error = next(link);
        assertEquals(MessageType.ERROR, error.type());
        assertEquals("m1", error.id());
        assertEquals("master busy", error.data().get("error").asText());
    }

    @Test
    void testBuildMasterTools_includesEnabledLocalServersAndContexts() {
        ProxyClient files = localClient("files");
        when(files.listTools()).thenReturn(Tools.tools("read"));
        ProxyClient hidden = localClient("hidden");
        proxy.registerLocalClient(files);
        proxy.registerLocalClient(hidden);
        proxy.setClientEnabled("hidden", false);
        when(contextStore.contextServerMappings()).thenReturn(Map.of("work", List.of("files")));

        SlaveMessages.MasterTools tools = server.buildMasterTools();

        assertEquals(List.of("files"), List.copyOf(tools.servers().keySet()));
        assertEquals(Map.of("work", List.of("files")), tools.contextMappings());
        JsonNode encoded = codec.toData(tools);
        assertTrue(encoded.has("context_mappings"));
    }

    @Test
    void testBuildMasterTools_contextStoreFailureYieldsNoMappings() {
        when(contextStore.contextServerMappings()).thenThrow(new DataAccessResourceFailureException("db down"));

        assertTrue(server.buildMasterTools().contextMappings().isEmpty());
    }

    @Test
    void testRestartAndUpgrade_sendControlFrames() throws Exception {
        SlaveLink link = registered("alpha");

        server.sendRestart("alpha");
        server.sendUpgrade("alpha");

        assertEquals(MessageType.RESTART, next(link).type());
        assertEquals(MessageType.UPGRADE, next(link).type());
        assertThrows(SlaveNotConnectedException.class, () -> server.sendRestart("ghost"));
    }

    @Test
    void testStop_closesLinksAndFailsPendingCalls() throws Exception {
        server = newServer(Runnable::run, Duration.ofSeconds(10));
        SlaveLink link = registered("alpha");
        CompletableFuture<JsonNode> result = CompletableFuture.supplyAsync(
                () -> server.sendToolCall("alpha", "echo", null));
        next(link);

        server.stop();

        assertTrue(((RecordingTransport) link.getTransport()).isClosed());
        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertEquals("tool call failed: link server stopped", e.getCause().getMessage());
    }

    private SlaveLink link(String host) {
        return new SlaveLink(new SlaveIdentity(host, "ab12"), new RecordingTransport());
    }

    private SlaveLink registered(String host) throws InterruptedException {
        SlaveLink link = link(host);
        server.onFrame(link, registerFrame(host));
        next(link);
        next(link);
        return link;
    }

    private static String registerFrame(String hostname) {
        return "{\"type\":\"register\",\"id\":\"r1\",\"data\":{\"hostname\":\"" + hostname + "\",\"version\":\"1.0\"}}";
    }

    private Message next(SlaveLink link) throws InterruptedException {
        return codec.decode(((RecordingTransport) link.getTransport()).nextFrame());
    }

    private static ProxyClient localClient(String name) {
        ProxyClient client = mock(ProxyClient.class);
        when(client.getName()).thenReturn(name);
        when(client.isRemote()).thenReturn(false);
        return client;
    }
}

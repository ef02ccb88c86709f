package com.github.acprelay.bridge;

import com.github.acprelay.services.MemoryProvider;
import com.github.acprelay.services.RelaySettings;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Session lifecycle, prompting and fault recovery against in-memory agents.
 */
class AcpRuntimeManagerTest {

    private static final long WAIT_MS = 5000;

    private final List<FakeAgentProcess> processes = new CopyOnWriteArrayList<>();
    private final AtomicInteger launches = new AtomicInteger();
    private volatile Consumer<MockAcpServer> serverSetup = server -> {
    };
    private volatile boolean failLaunches = false;

    private ExecutorService executor;
    private AcpRuntimeManager runtime;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) runtime.close();
        for (FakeAgentProcess process : processes) {
            process.getServer().close();
        }
        executor.shutdownNow();
    }

    // ========================
    // Helpers
    // ========================

    private ProcessLauncher launcher() {
        return command -> {
            launches.incrementAndGet();
            if (failLaunches) throw new IOException("agent binary missing");
            MockAcpServer server = new MockAcpServer();
            serverSetup.accept(server);
            server.start();
            FakeAgentProcess process = new FakeAgentProcess(server);
            processes.add(process);
            return process;
        };
    }

    private static RelaySettings settings(String... overrides) {
        Properties props = new Properties();
        props.setProperty(RelaySettings.KEY_PREWARM_RETRY_MS, "0");
        props.setProperty(RelaySettings.KEY_REQUEST_TIMEOUT_MS, "5000");
        props.setProperty(RelaySettings.KEY_TIMEOUT_MS, "10000");
        props.setProperty(RelaySettings.KEY_NO_OUTPUT_TIMEOUT_MS, "0");
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            props.setProperty(overrides[i], overrides[i + 1]);
        }
        return RelaySettings.fromProperties(props, Map.of());
    }

    private AcpRuntimeManager createRuntime(String... overrides) {
        runtime = new AcpRuntimeManager(new CliAgent(CliAgentType.GEMINI), settings(overrides),
            MemoryProvider.passthrough(), launcher());
        return runtime;
    }

    private MockAcpServer server(int index) {
        return processes.get(index).getServer();
    }

    private MockAcpServer latestServer() {
        return processes.isEmpty() ? null : processes.get(processes.size() - 1).getServer();
    }

    private static boolean receivedPrompt(MockAcpServer server, String text) {
        if (server == null) return false;
        return server.getReceivedRequests("session/prompt").stream()
            .map(request -> request.getAsJsonObject("params").getAsJsonArray("prompt").get(0).getAsJsonObject())
            .anyMatch(block -> text.equals(block.get("text").getAsString()));
    }

    private static void respondWithChunks(MockAcpServer server, String sessionId, String... chunks) {
        for (String chunk : chunks) {
            try {
                server.sendMessageChunk(sessionId, chunk);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private static void waitUntil(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) throw new AssertionError("Timed out waiting for " + description);
            Thread.sleep(10);
        }
    }

    private static Throwable causeOf(Future<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(WAIT_MS, TimeUnit.MILLISECONDS));
        return e.getCause();
    }

    private Future<String> promptAsync(String text, List<String> chunks) {
        return executor.submit(() -> runtime.runPrompt(text, chunks::add));
    }

    // ========================
    // Session establishment
    // ========================

    @Nested
    class SessionTests {

        @Test
        void testEnsureSessionReachesReady() throws Exception {
            createRuntime();
            runtime.ensureSession();

            AcpRuntimeManager.RuntimeState state = runtime.getRuntimeState();
            assertEquals(AcpState.READY, state.state());
            assertTrue(state.sessionReady());
            assertTrue(state.processRunning());
            assertEquals(1, launches.get());

            JsonObject init = server(0).awaitRequest("initialize", 0, WAIT_MS);
            assertEquals(1, init.getAsJsonObject("params").get("protocolVersion").getAsInt());
            JsonObject newSession = server(0).awaitRequest("session/new", 0, WAIT_MS);
            assertTrue(newSession.getAsJsonObject("params").getAsJsonArray("mcpServers").isEmpty());
        }

        @Test
        void testEnsureSessionIsNoOpWhenHealthy() throws Exception {
            createRuntime();
            runtime.ensureSession();
            runtime.ensureSession();
            assertEquals(1, launches.get());
        }

        @Test
        void testConcurrentEnsureSessionSpawnsOnce() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            serverSetup = server -> server.registerHandler("initialize", params -> {
                try {
                    release.await(WAIT_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                JsonObject result = new JsonObject();
                result.addProperty("protocolVersion", 1);
                return result;
            });
            createRuntime();

            List<Future<?>> callers = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                callers.add(executor.submit(() -> {
                    runtime.ensureSession();
                    return null;
                }));
            }
            waitUntil(() -> runtime.getRuntimeState().state() == AcpState.STARTING, "STARTING");
            Thread.sleep(100);
            release.countDown();

            for (Future<?> caller : callers) {
                caller.get(WAIT_MS, TimeUnit.MILLISECONDS);
            }
            assertEquals(1, launches.get(), "Only one process should be spawned");
            assertEquals(1, server(0).getReceivedRequests("initialize").size());
            assertEquals(1, server(0).getReceivedRequests("session/new").size());
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
        }

        @Test
        void testSpawnFailureLeavesIdle() {
            failLaunches = true;
            createRuntime();

            ProcessSpawnException e = assertThrows(ProcessSpawnException.class, runtime::ensureSession);
            assertTrue(e.getMessage().contains("agent binary missing"));
            assertFalse(e.isRecoverable());
            assertEquals(AcpState.IDLE, runtime.getRuntimeState().state());
        }

        @Test
        void testHandshakeInternalErrorCarriesHint() {
            serverSetup = server -> server.registerError("session/new", "Internal error");
            createRuntime();

            HandshakeException e = assertThrows(HandshakeException.class, runtime::ensureSession);
            assertNotNull(e.getHint());
            assertTrue(e.getMessage().contains("Internal error"));
            assertTrue(e.getMessage().contains("MCP server"), e.getMessage());
            assertEquals(AcpState.IDLE, runtime.getRuntimeState().state());
            assertTrue(processes.get(0).wasDestroyed(), "Failed handshake should terminate the process");
        }

        @Test
        void testHandshakeOtherErrorHasNoHint() {
            serverSetup = server -> server.registerError("initialize", "unsupported protocol");
            createRuntime();

            HandshakeException e = assertThrows(HandshakeException.class, runtime::ensureSession);
            assertNull(e.getHint());
            assertEquals("ACP error: unsupported protocol", e.getMessage());
        }

        @Test
        void testMcpServersFromSettingsArePassedToNewSession() throws Exception {
            createRuntime(RelaySettings.KEY_MCP_SERVERS_JSON,
                "[{\"name\":\"files\",\"command\":\"mcp-files\",\"args\":[],\"env\":[]}]");
            runtime.ensureSession();

            JsonObject newSession = server(0).awaitRequest("session/new", 0, WAIT_MS);
            assertEquals("files", newSession.getAsJsonObject("params").getAsJsonArray("mcpServers")
                .get(0).getAsJsonObject().get("name").getAsString());
        }

        @Test
        void testInvalidMcpServersJsonFallsBackToEmpty() throws Exception {
            createRuntime(RelaySettings.KEY_MCP_SERVERS_JSON, "{not json");
            runtime.ensureSession();

            JsonObject newSession = server(0).awaitRequest("session/new", 0, WAIT_MS);
            assertTrue(newSession.getAsJsonObject("params").getAsJsonArray("mcpServers").isEmpty());
        }

        @Test
        void testMemoryFailureSurfacesAsAcpException() {
            runtime = new AcpRuntimeManager(new CliAgent(CliAgentType.GEMINI), settings(), new MemoryProvider() {
                @Override
                public String buildPromptWithMemory(String userPrompt) {
                    return userPrompt;
                }

                @Override
                public void ensureMemoryFile() {
                    throw new IllegalStateException("read-only home");
                }
            }, launcher());

            AcpException e = assertThrows(AcpException.class, runtime::ensureSession);
            assertTrue(e.getMessage().contains("read-only home"));
            assertEquals(0, launches.get());
        }
    }

    // ========================
    // Prompting
    // ========================

    @Nested
    class PromptTests {

        @Test
        void testPromptStreamsChunksAndReturnsText() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                respondWithChunks(server, params.get("sessionId").getAsString(), "Hello ", "world");
                return MockAcpServer.stopReason("end_turn");
            });
            createRuntime();

            List<String> chunks = new CopyOnWriteArrayList<>();
            String result = runtime.runPrompt("hi", chunks::add);

            assertEquals("Hello world", result);
            assertEquals(List.of("Hello ", "world"), chunks);
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
            assertFalse(runtime.hasActivePrompt());

            JsonObject prompt = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            JsonObject block = prompt.getAsJsonObject("params").getAsJsonArray("prompt").get(0).getAsJsonObject();
            assertEquals("text", block.get("type").getAsString());
            assertEquals("hi", block.get("text").getAsString());
        }

        @Test
        void testOnlyMessageTextIsForwarded() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                String sessionId = params.get("sessionId").getAsString();
                try {
                    server.sendNotification("session/update", MockAcpServer.buildThoughtChunk(sessionId, "thinking"));
                    server.sendNotification("session/update", MockAcpServer.buildToolCall(sessionId, "call_1", "Read"));
                    server.sendNotification("session/update", MockAcpServer.buildMessageChunk("other-session", "stray"));
                    server.sendMessageChunk(sessionId, "answer");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return MockAcpServer.stopReason("end_turn");
            });
            createRuntime();

            List<String> chunks = new CopyOnWriteArrayList<>();
            assertEquals("answer", runtime.runPrompt("q", chunks::add));
            assertEquals(List.of("answer"), chunks);
        }

        @Test
        void testEmptyReplyReturnsPlaceholder() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> MockAcpServer.stopReason("end_turn"));
            createRuntime();

            assertEquals(AcpRuntimeManager.NO_RESPONSE, runtime.runPrompt("q", null));
        }

        @Test
        void testFailingChunkConsumerDoesNotBreakPrompt() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                respondWithChunks(server, params.get("sessionId").getAsString(), "a", "b");
                return MockAcpServer.stopReason("end_turn");
            });
            createRuntime();

            String result = runtime.runPrompt("q", chunk -> {
                throw new IllegalStateException("consumer broke");
            });
            assertEquals("ab", result);
        }

        @Test
        void testConcurrentPromptIsRejectedWithoutStateChange() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime();

            Future<String> first = promptAsync("first", new CopyOnWriteArrayList<>());
            JsonObject request = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            assertTrue(runtime.hasActivePrompt());

            for (int i = 0; i < 3; i++) {
                ConcurrentPromptException e = assertThrows(ConcurrentPromptException.class,
                    () -> runtime.runPrompt("second", null));
                assertEquals(AcpRuntimeManager.PROMPT_IN_PROGRESS, e.getMessage());
                assertEquals(AcpState.PROMPTING, runtime.getRuntimeState().state());
            }
            assertEquals(1, server(0).getReceivedRequests("session/prompt").size());

            server(0).sendResponse(request.get("id").getAsLong(), MockAcpServer.stopReason("end_turn"));
            assertEquals(AcpRuntimeManager.NO_RESPONSE, first.get(WAIT_MS, TimeUnit.MILLISECONDS));
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
        }

        @Test
        void testPromptErrorResponseFailsInvocation() throws Exception {
            serverSetup = server -> server.registerError("session/prompt", "model overloaded");
            createRuntime();

            AcpException e = assertThrows(AcpException.class, () -> runtime.runPrompt("q", null));
            assertEquals("ACP error: model overloaded", e.getMessage());
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
        }

        @Test
        void testMemoryIsAppliedToPromptText() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> MockAcpServer.stopReason("end_turn"));
            runtime = new AcpRuntimeManager(new CliAgent(CliAgentType.GEMINI), settings(), new MemoryProvider() {
                @Override
                public String buildPromptWithMemory(String userPrompt) {
                    return "[memory]\n" + userPrompt;
                }

                @Override
                public void ensureMemoryFile() {
                    // nothing to create
                }
            }, launcher());

            runtime.runPrompt("question", null);
            JsonObject prompt = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            assertEquals("[memory]\nquestion", prompt.getAsJsonObject("params").getAsJsonArray("prompt")
                .get(0).getAsJsonObject().get("text").getAsString());
        }

        @Test
        void testMemoryProviderHearsWhetherPromptWasDelivered() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                String text = params.getAsJsonArray("prompt").get(0).getAsJsonObject().get("text").getAsString();
                return text.equals("hang") ? null : MockAcpServer.stopReason("end_turn");
            });
            List<Boolean> outcomes = new CopyOnWriteArrayList<>();
            runtime = new AcpRuntimeManager(new CliAgent(CliAgentType.GEMINI),
                settings(RelaySettings.KEY_TIMEOUT_MS, "300"), new MemoryProvider() {
                @Override
                public String buildPromptWithMemory(String userPrompt) {
                    return userPrompt;
                }

                @Override
                public void ensureMemoryFile() {
                    // nothing to create
                }

                @Override
                public void onPromptFinished(boolean delivered) {
                    outcomes.add(delivered);
                    throw new IllegalStateException("listener broke");
                }
            }, launcher());

            runtime.runPrompt("ok", null);
            assertThrows(PromptTimeoutException.class, () -> runtime.runPrompt("hang", null));

            assertEquals(List.of(true, false), outcomes);
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
        }
    }

    // ========================
    // Timeouts
    // ========================

    @Nested
    class TimeoutTests {

        @Test
        void testOverallTimeout() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime(RelaySettings.KEY_TIMEOUT_MS, "300");

            long start = System.currentTimeMillis();
            PromptTimeoutException e = assertThrows(PromptTimeoutException.class, () -> runtime.runPrompt("q", null));
            assertTrue(System.currentTimeMillis() - start >= 250);
            assertEquals("Gemini CLI ACP timed out after 300ms", e.getMessage());
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());

            server(0).awaitRequest("session/cancel", 0, WAIT_MS);
        }

        @Test
        void testNoOutputTimeoutFiresAfterSilence() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime(RelaySettings.KEY_NO_OUTPUT_TIMEOUT_MS, "500");

            long start = System.currentTimeMillis();
            PromptNoOutputTimeoutException e = assertThrows(PromptNoOutputTimeoutException.class,
                () -> runtime.runPrompt("q", null));
            long elapsed = System.currentTimeMillis() - start;
            assertTrue(elapsed >= 450, "Timed out too early: " + elapsed);
            assertEquals("Gemini CLI ACP produced no output for 500ms", e.getMessage());
        }

        @Test
        void testSteadyFragmentsKeepPromptAlive() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime(RelaySettings.KEY_NO_OUTPUT_TIMEOUT_MS, "500");

            List<String> chunks = new CopyOnWriteArrayList<>();
            Future<String> prompt = promptAsync("q", chunks);
            JsonObject request = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            String sessionId = request.getAsJsonObject("params").get("sessionId").getAsString();

            // 1.5s of output, well past the 500ms window, in fragments 250ms apart
            for (int i = 0; i < 6; i++) {
                Thread.sleep(250);
                server(0).sendMessageChunk(sessionId, "part" + i + " ");
            }
            server(0).sendResponse(request.get("id").getAsLong(), MockAcpServer.stopReason("end_turn"));

            assertEquals("part0 part1 part2 part3 part4 part5 ", prompt.get(WAIT_MS, TimeUnit.MILLISECONDS));
        }

        @Test
        void testFragmentsThenSilenceTimesOut() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime(RelaySettings.KEY_NO_OUTPUT_TIMEOUT_MS, "500");

            Future<String> prompt = promptAsync("q", new CopyOnWriteArrayList<>());
            JsonObject request = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            String sessionId = request.getAsJsonObject("params").get("sessionId").getAsString();
            for (int i = 0; i < 3; i++) {
                Thread.sleep(250);
                server(0).sendMessageChunk(sessionId, "x");
            }
            long lastFragment = System.currentTimeMillis();

            assertInstanceOf(PromptNoOutputTimeoutException.class, causeOf(prompt));
            assertTrue(System.currentTimeMillis() - lastFragment >= 400);
        }

        @Test
        void testStderrActivityResetsNoOutputTimer() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime(RelaySettings.KEY_NO_OUTPUT_TIMEOUT_MS, "500");

            Future<String> prompt = promptAsync("q", new CopyOnWriteArrayList<>());
            JsonObject request = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            for (int i = 0; i < 4; i++) {
                Thread.sleep(250);
                server(0).writeStderr("still working " + i);
            }
            assertFalse(prompt.isDone(), "Diagnostics should keep the prompt alive");

            server(0).sendResponse(request.get("id").getAsLong(), MockAcpServer.stopReason("end_turn"));
            assertEquals(AcpRuntimeManager.NO_RESPONSE, prompt.get(WAIT_MS, TimeUnit.MILLISECONDS));
        }
    }

    // ========================
    // Cancellation
    // ========================

    @Nested
    class CancellationTests {

        private Future<String> startBlockedPrompt() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime();
            Future<String> prompt = promptAsync("q", new CopyOnWriteArrayList<>());
            server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            return prompt;
        }

        @Test
        void testManualAbort() throws Exception {
            Future<String> prompt = startBlockedPrompt();
            long promptId = server(0).awaitRequest("session/prompt", 0, WAIT_MS).get("id").getAsLong();

            runtime.requestManualAbort();
            runtime.cancelActivePrompt();
            server(0).awaitRequest("session/cancel", 0, WAIT_MS);
            server(0).sendResponse(promptId, MockAcpServer.stopReason("cancelled"));

            PromptCancelledException e = assertInstanceOf(PromptCancelledException.class, causeOf(prompt));
            assertTrue(e.isManualAbort());
            assertEquals("Gemini CLI ACP prompt was aborted by user", e.getMessage());
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());
        }

        @Test
        void testExternalCancel() throws Exception {
            Future<String> prompt = startBlockedPrompt();
            long promptId = server(0).awaitRequest("session/prompt", 0, WAIT_MS).get("id").getAsLong();

            server(0).sendResponse(promptId, MockAcpServer.stopReason("cancelled"));

            PromptCancelledException e = assertInstanceOf(PromptCancelledException.class, causeOf(prompt));
            assertFalse(e.isManualAbort());
            assertEquals("Gemini CLI ACP prompt was cancelled", e.getMessage());
        }

        @Test
        void testCancelledWithPartialTextCountsAsSuccess() throws Exception {
            Future<String> prompt = startBlockedPrompt();
            JsonObject request = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            String sessionId = request.getAsJsonObject("params").get("sessionId").getAsString();

            server(0).sendMessageChunk(sessionId, "partial answer");
            server(0).sendResponse(request.get("id").getAsLong(), MockAcpServer.stopReason("cancelled"));

            assertEquals("partial answer", prompt.get(WAIT_MS, TimeUnit.MILLISECONDS));
        }

        @Test
        void testManualAbortFlagIsConsumedBySettlement() throws Exception {
            Future<String> prompt = startBlockedPrompt();
            long firstId = server(0).awaitRequest("session/prompt", 0, WAIT_MS).get("id").getAsLong();
            runtime.requestManualAbort();
            server(0).sendResponse(firstId, MockAcpServer.stopReason("cancelled"));
            assertTrue(((PromptCancelledException) causeOf(prompt)).isManualAbort());

            Future<String> second = promptAsync("again", new CopyOnWriteArrayList<>());
            long secondId = server(0).awaitRequest("session/prompt", 1, WAIT_MS).get("id").getAsLong();
            server(0).sendResponse(secondId, MockAcpServer.stopReason("cancelled"));
            assertFalse(((PromptCancelledException) causeOf(second)).isManualAbort());
        }
    }

    // ========================
    // Faults, prewarm and shutdown
    // ========================

    @Nested
    class LifecycleTests {

        @Test
        void testProcessExitDuringPromptResetsToIdle() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime();

            Future<String> prompt = promptAsync("q", new CopyOnWriteArrayList<>());
            server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            failLaunches = true;
            processes.get(0).simulateExit(1);

            assertInstanceOf(AcpException.class, causeOf(prompt));
            waitUntil(() -> launches.get() >= 2 && runtime.getRuntimeState().state() == AcpState.IDLE,
                "reset and failed prewarm");
            AcpRuntimeManager.RuntimeState state = runtime.getRuntimeState();
            assertFalse(state.sessionReady());
            assertFalse(state.processRunning());
            assertFalse(runtime.hasActivePrompt());
        }

        @Test
        void testPromptRightAfterCrashDuringPromptSucceeds() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                String text = params.getAsJsonArray("prompt").get(0).getAsJsonObject().get("text").getAsString();
                if (text.equals("hang")) return null;
                respondWithChunks(server, params.get("sessionId").getAsString(), "ok");
                return MockAcpServer.stopReason("end_turn");
            });
            createRuntime();

            for (int round = 0; round < 20; round++) {
                Future<String> hung = promptAsync("hang", new CopyOnWriteArrayList<>());
                waitUntil(() -> runtime.hasActivePrompt() && receivedPrompt(latestServer(), "hang"), "hung prompt");
                processes.get(processes.size() - 1).simulateExit(1);

                assertInstanceOf(AcpException.class, causeOf(hung), "round " + round);
                AcpState afterCrash = runtime.getRuntimeState().state();
                assertTrue(afterCrash == AcpState.IDLE || afterCrash == AcpState.STARTING || afterCrash == AcpState.READY,
                    "round " + round + " left the runtime in " + afterCrash);

                assertEquals("ok", runtime.runPrompt("next message", null), "round " + round);
                assertEquals(AcpState.READY, runtime.getRuntimeState().state());
            }
            assertEquals(21, launches.get(), "One replacement agent per crash");
        }

        @Test
        void testNextPromptAfterCrashStartsFreshSession() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> {
                respondWithChunks(server, params.get("sessionId").getAsString(), params.get("sessionId").getAsString());
                return MockAcpServer.stopReason("end_turn");
            });
            createRuntime();
            runtime.ensureSession();

            processes.get(0).simulateExit(137);
            waitUntil(() -> launches.get() == 2 && runtime.getRuntimeState().state() == AcpState.READY,
                "prewarmed replacement session");

            assertEquals("mock-session-1", runtime.runPrompt("q", null),
                "Each mock agent numbers its own sessions from 1");
            assertEquals(1, server(1).getReceivedRequests("session/prompt").size());
            assertTrue(server(0).getReceivedRequests("session/prompt").isEmpty());
        }

        @Test
        void testPrewarmEstablishesSession() throws Exception {
            createRuntime();
            runtime.scheduleAcpPrewarm("startup");
            waitUntil(() -> runtime.getRuntimeState().sessionReady(), "prewarm");
            assertEquals(AcpState.READY, runtime.getRuntimeState().state());

            runtime.scheduleAcpPrewarm("again");
            Thread.sleep(100);
            assertEquals(1, launches.get(), "Prewarm on a healthy runtime is a no-op");
        }

        @Test
        void testPrewarmRetriesStopAtLimit() throws Exception {
            failLaunches = true;
            createRuntime(RelaySettings.KEY_PREWARM_RETRY_MS, "20", RelaySettings.KEY_PREWARM_MAX_RETRIES, "3");

            runtime.scheduleAcpPrewarm("startup");
            waitUntil(() -> runtime.getPrewarmRetryAttempts() == 3, "three prewarm attempts");
            Thread.sleep(200);
            assertEquals(3, launches.get());
            assertEquals(AcpState.IDLE, runtime.getRuntimeState().state());
        }

        @Test
        void testShutdownTerminatesAgent() throws Exception {
            createRuntime();
            runtime.ensureSession();

            runtime.shutdown("test");

            AcpRuntimeManager.RuntimeState state = runtime.getRuntimeState();
            assertEquals(AcpState.IDLE, state.state());
            assertFalse(state.sessionReady());
            assertFalse(state.processRunning());
            assertTrue(processes.get(0).wasDestroyed());
        }

        @Test
        void testShutdownFailsActivePrompt() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime();
            Future<String> prompt = promptAsync("q", new CopyOnWriteArrayList<>());
            server(0).awaitRequest("session/prompt", 0, WAIT_MS);

            runtime.shutdown("user-shutdown");

            Throwable cause = causeOf(prompt);
            assertInstanceOf(AcpException.class, cause);
            assertEquals("Gemini CLI ACP runtime shut down (user-shutdown)", cause.getMessage());
            assertEquals(AcpState.IDLE, runtime.getRuntimeState().state());
        }

        @Test
        void testCloseRejectsFurtherSessions() throws Exception {
            createRuntime();
            runtime.ensureSession();
            runtime.close();

            assertThrows(AcpException.class, runtime::ensureSession);
            assertTrue(processes.get(0).wasDestroyed());
        }
    }

    // ========================
    // Context injection and inbound requests
    // ========================

    @Nested
    class InboundTests {

        @Test
        void testAppendContextSuppressedWithoutSession() {
            createRuntime();
            assertFalse(runtime.appendContext("job finished"));
            assertEquals(0, launches.get());
        }

        @Test
        void testAppendContextFiresPrompt() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> MockAcpServer.stopReason("end_turn"));
            createRuntime();
            runtime.ensureSession();

            assertTrue(runtime.appendContext("job finished"));
            JsonObject prompt = server(0).awaitRequest("session/prompt", 0, WAIT_MS);
            String text = prompt.getAsJsonObject("params").getAsJsonArray("prompt")
                .get(0).getAsJsonObject().get("text").getAsString();
            assertTrue(text.startsWith("[SYSTEM: CONTEXT UPDATE]"));
            assertTrue(text.endsWith("Result:\njob finished"));
        }

        @Test
        void testAppendContextSuppressedWhilePrompting() throws Exception {
            serverSetup = server -> server.registerHandler("session/prompt", params -> null);
            createRuntime();
            promptAsync("q", new CopyOnWriteArrayList<>());
            server(0).awaitRequest("session/prompt", 0, WAIT_MS);

            assertFalse(runtime.appendContext("job finished"));
            assertEquals(1, server(0).getReceivedRequests("session/prompt").size());
        }

        @Test
        void testPermissionRequestUsesStrategy() throws Exception {
            createRuntime(RelaySettings.KEY_PERMISSION_STRATEGY, "allow_always");
            runtime.ensureSession();

            server(0).sendAgentRequest(100, "session/request_permission",
                MockAcpServer.buildRequestPermission("mock-session-1", "call_1"));
            JsonObject response = server(0).awaitResponse(100, WAIT_MS);

            JsonObject outcome = response.getAsJsonObject("result").getAsJsonObject("outcome");
            assertEquals("selected", outcome.get("outcome").getAsString());
            assertEquals("allow_always", outcome.get("optionId").getAsString());
        }

        @Test
        void testFileRequestsAreNoOps() throws Exception {
            createRuntime();
            runtime.ensureSession();

            JsonObject params = new JsonObject();
            params.addProperty("path", "/tmp/x.txt");
            server(0).sendAgentRequest(200, "fs/read_text_file", params);
            JsonObject read = server(0).awaitResponse(200, WAIT_MS);
            assertEquals("", read.getAsJsonObject("result").get("content").getAsString());

            params.addProperty("content", "data");
            server(0).sendAgentRequest(201, "fs/write_text_file", params);
            JsonObject write = server(0).awaitResponse(201, WAIT_MS);
            assertTrue(write.getAsJsonObject("result").entrySet().isEmpty());
        }

        @Test
        void testUnknownAgentRequestIsRejected() throws Exception {
            createRuntime();
            runtime.ensureSession();

            server(0).sendAgentRequest(300, "terminal/create", new JsonObject());
            JsonObject response = server(0).awaitResponse(300, WAIT_MS);

            JsonObject error = response.getAsJsonObject("error");
            assertEquals(-32601, error.get("code").getAsInt());
            assertEquals("Method not supported: terminal/create", error.get("message").getAsString());
        }
    }

    @Test
    void testBuildAgentAcpArgs() {
        runtime = new AcpRuntimeManager(
            new CliAgent(CliAgentType.QWEN, null, "yolo", "qwen3-coder", List.of("/a", "/b", "/a"), 100),
            settings(), MemoryProvider.passthrough(), launcher());

        assertEquals(List.of("--experimental-acp", "--include-directories", "/a", "--include-directories", "/b",
            "--approval-mode", "yolo", "--model", "qwen3-coder"), runtime.buildAgentAcpArgs());
    }
}

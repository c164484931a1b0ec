package com.navcaddy.core.classifier;

import com.navcaddy.core.clarification.ClarificationGenerator;
import com.navcaddy.core.context.ContextInjector;
import com.navcaddy.core.context.SessionContextStore;
import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.error.ErrorMessages;
import com.navcaddy.core.llm.LanguageModelClient;
import com.navcaddy.core.llm.LanguageModelRequest;
import com.navcaddy.core.llm.LlmProperties;
import com.navcaddy.core.metrics.NavCaddyMetrics;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.Module;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.normalizer.InputNormalizer;
import com.navcaddy.core.offline.OfflineCapability;
import com.navcaddy.core.offline.OfflineIntentMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentClassifierTest {

    private LanguageModelClient model;
    private SimpleMeterRegistry registry;
    private ExecutorService executor;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        model = mock(LanguageModelClient.class);
        registry = new SimpleMeterRegistry();
        executor = Executors.newCachedThreadPool();
        classifier = classifierWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private IntentClassifier classifierWithTimeout(Duration timeout) {
        var properties = new LlmProperties();
        properties.setTimeout(timeout);
        var router = new ConfidenceRouter(new ClarificationGenerator());
        return new IntentClassifier(model, new InputNormalizer(), new ContextInjector(), new ModelResponseParser(),
                router, new OfflineIntentMatcher(router), new NavCaddyMetrics(registry), properties, executor);
    }

    private static String reply(String intent, double confidence, String entities) {
        return "{\"intent_type\":\"" + intent + "\",\"confidence\":" + confidence
                + ",\"entities\":" + entities + "}";
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("A: confident club complaint routes to club adjustment with 7-Iron")
        void scenarioA() {
            when(model.complete(any())).thenReturn(reply("CLUB_ADJUSTMENT", 0.85, "{\"club\":\"7-iron\"}"));

            ClassificationResult result = classifier.classify("My 7i feels long today", SessionContext.empty());

            var route = assertInstanceOf(ClassificationResult.Route.class, result);
            assertEquals(IntentType.CLUB_ADJUSTMENT, route.intent().intentType());
            assertEquals(Module.CADDY, route.target().module());
            assertEquals("ClubAdjustmentScreen", route.target().screen());
            assertEquals("7-Iron", route.intent().entities().club().name());
        }

        @Test
        @DisplayName("B: vague input clarifies with up to three suggestions")
        void scenarioB() {
            when(model.complete(any())).thenReturn(reply("CLUB_ADJUSTMENT", 0.35, "{}"));

            ClassificationResult result = classifier.classify("It feels off today", SessionContext.empty());

            var clarify = assertInstanceOf(ClassificationResult.Clarify.class, result);
            assertEquals("It feels off today", clarify.originalInput());
            assertTrue(clarify.suggestions().size() >= 1 && clarify.suggestions().size() <= 3);
            assertEquals(IntentType.CLUB_ADJUSTMENT, clarify.suggestions().get(0).intentType());
            String message = clarify.message().toLowerCase();
            assertTrue(message.contains("not sure") || message.contains("did you mean")
                    || message.contains("which of these"));
        }

        @Test
        @DisplayName("C: empty input is rejected without calling the model")
        void scenarioC() {
            ClassificationResult result = classifier.classify("", SessionContext.empty());

            var error = assertInstanceOf(ClassificationResult.Error.class, result);
            assertEquals(ErrorKind.INPUT_EMPTY, error.kind());
            assertEquals(ErrorMessages.INPUT_EMPTY, error.message());
            verify(model, never()).complete(any());
        }
    }

    @Test
    @DisplayName("sends normalized input and the session context to the model")
    void sendsContext() {
        when(model.complete(any())).thenReturn(reply("SHOT_RECOMMENDATION", 0.9, "{}"));
        var store = new SessionContextStore();
        store.updateRound("R-1", "Pebble Beach", 7, 3);

        classifier.classify("one fifty with the 7i?", store.snapshot());

        var captor = ArgumentCaptor.forClass(LanguageModelRequest.class);
        verify(model).complete(captor.capture());
        LanguageModelRequest request = captor.getValue();
        assertEquals("150 with the 7-iron?", request.userInput());
        assertTrue(request.contextBlock().contains("Pebble Beach"));
        assertTrue(request.systemPrompt().contains("CLUB_ADJUSTMENT"));
        assertTrue(request.userMessage().endsWith("# User Input\n150 with the 7-iron?"));
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("malformed reply becomes a recoverable error, never a guess")
        void malformedReply() {
            when(model.complete(any())).thenReturn("I think they want a club adjustment");

            ClassificationResult result = classifier.classify("my 7i is off", SessionContext.empty());

            var error = assertInstanceOf(ClassificationResult.Error.class, result);
            assertEquals(ErrorKind.INVALID_MODEL_RESPONSE, error.kind());
            assertTrue(error.recoverable());
            assertEquals(ErrorMessages.CLASSIFICATION_FAILED, error.message());
            assertEquals(1.0, registry.find("navcaddy.model.failures")
                    .tag("reason", "invalid_model_response").counter().count());
        }

        @Test
        @DisplayName("slow model times out with the same user message as a malformed reply")
        void timeout() {
            classifier = classifierWithTimeout(Duration.ofMillis(100));
            when(model.complete(any())).thenAnswer(inv -> {
                Thread.sleep(2_000);
                return reply("HELP_REQUEST", 0.9, "{}");
            });

            ClassificationResult result = classifier.classify("what should I hit", SessionContext.empty());

            var error = assertInstanceOf(ClassificationResult.Error.class, result);
            assertEquals(ErrorKind.CLASSIFICATION_TIMEOUT, error.kind());
            assertEquals(ErrorMessages.CLASSIFICATION_FAILED, error.message());
            assertNotNull(registry.find("navcaddy.model.failures").tag("reason", "classification_timeout").counter());
        }

        @Test
        @DisplayName("timing out interrupts the thread running the model call")
        void timeoutInterruptsModelCall() throws Exception {
            classifier = classifierWithTimeout(Duration.ofMillis(100));
            var interrupted = new CountDownLatch(1);
            when(model.complete(any())).thenAnswer(inv -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return reply("HELP_REQUEST", 0.9, "{}");
            });

            ClassificationResult result = classifier.classify("what should I hit", SessionContext.empty());

            assertEquals(ErrorKind.CLASSIFICATION_TIMEOUT, assertInstanceOf(ClassificationResult.Error.class, result).kind());
            assertTrue(interrupted.await(1, TimeUnit.SECONDS), "model thread was not interrupted");
        }

        @Test
        @DisplayName("connection failure is categorised as a network error")
        void networkFailure() {
            when(model.complete(any())).thenThrow(new IllegalStateException("I/O error",
                    new ConnectException("Connection refused")));

            ClassificationResult result = classifier.classify("what should I hit", SessionContext.empty());

            var error = assertInstanceOf(ClassificationResult.Error.class, result);
            assertEquals(ErrorKind.CLASSIFICATION_NETWORK_FAILURE, error.kind());
            assertTrue(error.recoverable());
            assertEquals(OfflineCapability.NO_MATCH_MESSAGE, error.message());
        }
    }

    @Nested
    @DisplayName("offline fallback")
    class OfflineTests {

        @BeforeEach
        void modelUnreachable() {
            when(model.complete(any())).thenThrow(new IllegalStateException("I/O error",
                    new ConnectException("Connection refused")));
        }

        @Test
        @DisplayName("a clear offline intent is routed from local keywords")
        void routesOffline() {
            ClassificationResult result = classifier.classify("enter my score for hole 7", SessionContext.empty());

            var route = assertInstanceOf(ClassificationResult.Route.class, result);
            assertEquals(IntentType.SCORE_ENTRY, route.intent().intentType());
            assertEquals(7, route.intent().entities().holeNumber());
            assertEquals(1.0, registry.find("navcaddy.model.failures")
                    .tag("reason", "classification_network_failure").counter().count());
            assertEquals(1.0, registry.find("navcaddy.classification.outcomes")
                    .tag("outcome", "route").counter().count());
        }

        @Test
        @DisplayName("an online-only request explains what needs a connection")
        void onlineOnly() {
            ClassificationResult result = classifier.classify("what's the weather forecast", SessionContext.empty());

            var error = assertInstanceOf(ClassificationResult.Error.class, result);
            assertEquals(ErrorKind.CLASSIFICATION_NETWORK_FAILURE, error.kind());
            assertEquals(OfflineCapability.limitationMessage(IntentType.WEATHER_CHECK), error.message());
        }

        @Test
        @DisplayName("timeouts never fall back to offline matching")
        void timeoutStaysAnError() {
            classifier = classifierWithTimeout(Duration.ofMillis(100));
            reset(model);
            when(model.complete(any())).thenAnswer(inv -> {
                Thread.sleep(2_000);
                return reply("SCORE_ENTRY", 0.9, "{}");
            });

            ClassificationResult result = classifier.classify("enter my score", SessionContext.empty());

            assertEquals(ErrorKind.CLASSIFICATION_TIMEOUT,
                    assertInstanceOf(ClassificationResult.Error.class, result).kind());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancelling the token abandons a pending model call")
        void cancelWhileWaiting() throws Exception {
            var started = new CountDownLatch(1);
            when(model.complete(any())).thenAnswer(inv -> {
                started.countDown();
                Thread.sleep(3_000);
                return reply("HELP_REQUEST", 0.9, "{}");
            });
            var token = new CancellationToken();

            CompletableFuture<ClassificationResult> pending = CompletableFuture.supplyAsync(
                    () -> classifier.classify("what should I hit", SessionContext.empty(), token));
            assertTrue(started.await(2, TimeUnit.SECONDS));
            token.cancel();

            var thrown = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
            assertInstanceOf(ClassificationCancelledException.class, thrown.getCause());
        }

        @Test
        @DisplayName("cancelling the token interrupts the in-flight model call")
        void cancelInterruptsModelCall() throws Exception {
            var started = new CountDownLatch(1);
            var interrupted = new CountDownLatch(1);
            when(model.complete(any())).thenAnswer(inv -> {
                started.countDown();
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return reply("HELP_REQUEST", 0.9, "{}");
            });
            var token = new CancellationToken();

            CompletableFuture<ClassificationResult> pending = CompletableFuture.supplyAsync(
                    () -> classifier.classify("what should I hit", SessionContext.empty(), token));
            assertTrue(started.await(2, TimeUnit.SECONDS));
            token.cancel();

            assertTrue(interrupted.await(1, TimeUnit.SECONDS), "model thread was not interrupted");
            var thrown = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
            assertInstanceOf(ClassificationCancelledException.class, thrown.getCause());
        }

        @Test
        @DisplayName("an already-cancelled token never reaches the model")
        void alreadyCancelled() {
            var token = new CancellationToken();
            token.cancel();

            assertThrows(ClassificationCancelledException.class,
                    () -> classifier.classify("what should I hit", SessionContext.empty(), token));
            verify(model, never()).complete(any());
        }
    }

    @Test
    @DisplayName("records the outcome of every classification")
    void recordsOutcomes() {
        when(model.complete(any())).thenReturn(reply("CLUB_ADJUSTMENT", 0.9, "{}"));

        classifier.classify("my 7i", SessionContext.empty());
        classifier.classify(" ", SessionContext.empty());

        assertEquals(1.0, registry.find("navcaddy.classification.outcomes").tag("outcome", "route").counter().count());
        assertEquals(1.0, registry.find("navcaddy.classification.outcomes").tag("outcome", "error").counter().count());
    }
}

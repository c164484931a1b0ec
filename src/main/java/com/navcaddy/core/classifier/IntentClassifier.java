package com.navcaddy.core.classifier;

import com.navcaddy.core.context.ContextInjector;
import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.error.ErrorMessages;
import com.navcaddy.core.error.NavCaddyError;
import com.navcaddy.core.llm.LanguageModelClient;
import com.navcaddy.core.llm.LanguageModelRequest;
import com.navcaddy.core.llm.LlmParseException;
import com.navcaddy.core.llm.LlmProperties;
import com.navcaddy.core.metrics.NavCaddyMetrics;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.normalizer.InputNormalizer;
import com.navcaddy.core.offline.OfflineIntentMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one raw utterance into a {@link ClassificationResult}.
 * <p>
 * Pipeline: reject blank input, normalize, render session context, call the language model
 * (bounded by {@code navcaddy.llm.timeout}), parse and validate the reply, then let the
 * {@link ConfidenceRouter} pick the outcome. Model failures become an
 * {@link ClassificationResult.Error}; a malformed reply is never guessed around. When the model
 * cannot be reached at all, the {@link OfflineIntentMatcher} answers from local keywords instead.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private final LanguageModelClient languageModel;
    private final InputNormalizer normalizer;
    private final ContextInjector contextInjector;
    private final ModelResponseParser parser;
    private final ConfidenceRouter router;
    private final OfflineIntentMatcher offlineMatcher;
    private final NavCaddyMetrics metrics;
    private final Duration timeout;
    private final ExecutorService modelExecutor;

    public IntentClassifier(LanguageModelClient languageModel,
                            InputNormalizer normalizer,
                            ContextInjector contextInjector,
                            ModelResponseParser parser,
                            ConfidenceRouter router,
                            OfflineIntentMatcher offlineMatcher,
                            NavCaddyMetrics metrics,
                            LlmProperties properties,
                            @Qualifier("modelCallExecutor") ExecutorService modelExecutor) {
        this.languageModel = languageModel;
        this.normalizer = normalizer;
        this.contextInjector = contextInjector;
        this.parser = parser;
        this.router = router;
        this.offlineMatcher = offlineMatcher;
        this.metrics = metrics;
        this.timeout = properties.getTimeout();
        this.modelExecutor = modelExecutor;
    }

    public ClassificationResult classify(String rawInput, SessionContext context) {
        return classify(rawInput, context, CancellationToken.none());
    }

    /**
     * @throws ClassificationCancelledException if {@code token} is cancelled before a result is ready
     */
    public ClassificationResult classify(String rawInput, SessionContext context, CancellationToken token) {
        if (rawInput == null || rawInput.isBlank()) {
            log.info("Blank input rejected, no model call made");
            metrics.recordClassificationOutcome("error");
            return new ClassificationResult.Error(ErrorMessages.INPUT_EMPTY, ErrorKind.INPUT_EMPTY, true);
        }
        token.throwIfCancelled();

        String normalized = normalizer.normalize(rawInput);
        String contextBlock = contextInjector.buildPrompt(context == null ? SessionContext.empty() : context);
        var request = new LanguageModelRequest(ClassificationPrompt.systemPrompt(), contextBlock, normalized);
        log.info("Classifying input ({} chars, context {} chars)", normalized.length(), contextBlock.length());

        String reply;
        try {
            reply = callModel(request, token);
        } catch (ModelCallFailure failure) {
            if (failure.error.kind() == ErrorKind.CLASSIFICATION_NETWORK_FAILURE) {
                return offline(failure.error, normalized, rawInput);
            }
            return failed(failure.error);
        }
        token.throwIfCancelled();

        ParsedIntent intent;
        try {
            intent = parser.parse(reply);
        } catch (LlmParseException e) {
            log.debug("Unparseable model reply: {}", reply);
            return failed(NavCaddyError.fromThrowable(e));
        }
        token.throwIfCancelled();

        ClassificationResult result = router.route(intent, normalized, rawInput);
        String outcome = outcomeName(result);
        log.info("Classified as {} ({}) -> {}", intent.intentType(),
                String.format(Locale.ROOT, "%.2f", intent.confidence()), outcome);
        metrics.recordClassificationOutcome(outcome);
        return result;
    }

    /**
     * Runs the model call on the model executor. Timeout and cancellation interrupt the worker thread
     * so the HTTP exchange is abandoned and the pool slot is released.
     */
    private String callModel(LanguageModelRequest request, CancellationToken token) {
        long start = System.currentTimeMillis();
        Future<String> call = modelExecutor.submit(() -> languageModel.complete(request));
        token.onCancel(() -> call.cancel(true));
        boolean success = false;
        try {
            String reply = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            success = true;
            return reply;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Model call exceeded {} ms timeout", timeout.toMillis());
            throw new ModelCallFailure(NavCaddyError.fromThrowable(e));
        } catch (CancellationException e) {
            log.info("Model call cancelled");
            throw new ClassificationCancelledException("Superseded by a newer input");
        } catch (ExecutionException e) {
            throw new ModelCallFailure(NavCaddyError.fromThrowable(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new ClassificationCancelledException("Interrupted while waiting for the model");
        } finally {
            metrics.recordModelCall(System.currentTimeMillis() - start, success);
        }
    }

    private ClassificationResult failed(NavCaddyError error) {
        ErrorKind kind = error.kind();
        if (kind == ErrorKind.UNKNOWN) {
            log.error("Model call failed: {}", error.message(), error.cause());
        } else {
            log.warn("Classification failed ({}): {}", kind, error.message());
        }
        metrics.recordModelFailure(kind.name().toLowerCase(Locale.ROOT));
        metrics.recordClassificationOutcome("error");
        return new ClassificationResult.Error(ErrorMessages.forClassification(kind), kind, kind.isRetryable());
    }

    private ClassificationResult offline(NavCaddyError error, String normalized, String rawInput) {
        log.warn("Model unreachable ({}), classifying offline", error.message());
        metrics.recordModelFailure(error.kind().name().toLowerCase(Locale.ROOT));
        ClassificationResult result = offlineMatcher.match(normalized, rawInput);
        metrics.recordClassificationOutcome(outcomeName(result));
        return result;
    }

    static String outcomeName(ClassificationResult result) {
        return result.fold(r -> "route", c -> "confirm", c -> "clarify", e -> "error");
    }

    /** Carries a categorised model failure out of {@link #callModel}. */
    private static final class ModelCallFailure extends RuntimeException {
        private final transient NavCaddyError error;

        ModelCallFailure(NavCaddyError error) {
            super(error.message(), error.cause(), false, false);
            this.error = error;
        }
    }
}

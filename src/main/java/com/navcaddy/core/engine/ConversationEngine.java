package com.navcaddy.core.engine;

import com.navcaddy.core.classifier.CancellationToken;
import com.navcaddy.core.classifier.IntentClassifier;
import com.navcaddy.core.error.ErrorMessages;
import com.navcaddy.core.error.NavCaddyError;
import com.navcaddy.core.events.ConversationAnalytics;
import com.navcaddy.core.events.EventBus;
import com.navcaddy.core.events.InputType;
import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.logging.MdcContext;
import com.navcaddy.core.metrics.NavCaddyMetrics;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.MissPattern;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.persona.DisclaimerType;
import com.navcaddy.core.persona.FormatOptions;
import com.navcaddy.core.persona.FormattedResponse;
import com.navcaddy.core.persona.ResponseFormatter;
import com.navcaddy.core.routing.RoutingDecision;
import com.navcaddy.core.routing.RoutingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs conversation turns for live sessions.
 * <p>
 * Each {@link #submit} classifies the input against a snapshot of the session, acts on the
 * outcome, and appends the exchange to the session history. A newer submit for the same session
 * cancels the older one; a cancelled turn never writes to the session and its future completes
 * with {@link com.navcaddy.core.classifier.ClassificationCancelledException}.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    static final String GENERIC_CONFIRM = "I'll help you with that.";

    /** Intents whose replies may cite the player's miss patterns. */
    private static final Set<IntentType> PATTERN_INTENTS = EnumSet.of(
            IntentType.SHOT_RECOMMENDATION, IntentType.CLUB_ADJUSTMENT, IntentType.DRILL_REQUEST);

    private final SessionRegistry sessions;
    private final IntentClassifier classifier;
    private final RoutingOrchestrator routing;
    private final RouteActionHandler actionHandler;
    private final ResponseFormatter formatter;
    private final MissPatternRepository patterns;
    private final ConversationAnalytics analytics;
    private final EventBus eventBus;
    private final NavCaddyMetrics metrics;
    private final Executor turnExecutor;

    public ConversationEngine(SessionRegistry sessions,
                              IntentClassifier classifier,
                              RoutingOrchestrator routing,
                              RouteActionHandler actionHandler,
                              ResponseFormatter formatter,
                              MissPatternRepository patterns,
                              ConversationAnalytics analytics,
                              EventBus eventBus,
                              NavCaddyMetrics metrics,
                              @Qualifier("conversationExecutor") Executor turnExecutor) {
        this.sessions = sessions;
        this.classifier = classifier;
        this.routing = routing;
        this.actionHandler = actionHandler;
        this.formatter = formatter;
        this.patterns = patterns;
        this.analytics = analytics;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.turnExecutor = turnExecutor;
    }

    public String startSession() {
        return sessions.create().id();
    }

    /**
     * Queues one user input for the session. Supersedes any turn still running for it.
     *
     * @throws UnknownSessionException if the session does not exist
     */
    public CompletableFuture<TurnOutcome> submit(String sessionId, String input, InputType inputType) {
        ConversationSession session = sessions.require(sessionId);
        var token = new CancellationToken();
        if (session.beginTurn(token)) {
            log.info("Session {}: newer input supersedes the running turn", sessionId);
            metrics.recordSupersededTurn();
        }
        String turnId = session.nextTurnId();
        return CompletableFuture
                .supplyAsync(() -> runTurn(session, turnId, input, inputType, token), turnExecutor)
                .whenComplete((outcome, error) -> session.finishTurn(token));
    }

    /**
     * Runs a clarification suggestion the user picked as if it had been classified with full confidence.
     */
    public TurnOutcome selectSuggestion(String sessionId, IntentType intentType) {
        ConversationSession session = sessions.require(sessionId);
        var token = new CancellationToken();
        if (session.beginTurn(token)) {
            metrics.recordSupersededTurn();
        }
        MdcContext.setTurn(sessionId, session.nextTurnId());
        try {
            analytics.suggestionSelected(sessionId, intentType);
            var intent = new ParsedIntent(intentType, 1.0, ExtractedEntities.empty(), null,
                    IntentRegistry.resolveTarget(intentType, ExtractedEntities.empty()));
            SessionContext snapshot = session.store().snapshot();
            TurnOutcome outcome = intent.routingTarget() == null
                    ? TurnOutcome.confirm(intent, GENERIC_CONFIRM)
                    : handleRoute(session, new ClassificationResult.Route(intent, intent.routingTarget()), snapshot);
            String label = IntentRegistry.getSchema(intentType).suggestionLabel();
            commit(session, token, label, outcome);
            return outcome;
        } finally {
            session.finishTurn(token);
            MdcContext.clear();
        }
    }

    public void updateRound(String sessionId, String roundId, String courseName, int hole, int par) {
        ConversationSession session = sessions.require(sessionId);
        session.store().updateRound(roundId, courseName, hole, par);
        log.info("Session {}: round {} at {} hole {}", sessionId, roundId, courseName, hole);
    }

    public SessionContext snapshot(String sessionId) {
        return sessions.require(sessionId).store().snapshot();
    }

    /**
     * Cancels any running turn, clears the context and forgets the session.
     *
     * @return {@code false} if the session was unknown
     */
    public boolean endSession(String sessionId) {
        return sessions.remove(sessionId).map(session -> {
            session.cancelLiveTurn();
            int turns = session.store().snapshot().conversationHistory().size();
            session.store().clear();
            analytics.sessionEnded(sessionId, turns);
            eventBus.removeSession(sessionId);
            log.info("Session {} ended", sessionId);
            return true;
        }).orElse(false);
    }

    TurnOutcome runTurn(ConversationSession session, String turnId, String input, InputType inputType,
                        CancellationToken token) {
        MdcContext.setTurn(session.id(), turnId);
        try {
            analytics.inputReceived(session.id(), inputType, input == null ? 0 : input.length());
            SessionContext snapshot = session.store().snapshot();

            long start = System.currentTimeMillis();
            ClassificationResult result = classifier.classify(input, snapshot, token);
            long latency = System.currentTimeMillis() - start;

            TurnOutcome outcome = result.fold(
                    route -> {
                        analytics.intentClassified(session.id(), route.intent(), latency, true);
                        return handleRoute(session, route, snapshot);
                    },
                    confirm -> {
                        analytics.intentClassified(session.id(), confirm.intent(), latency, true);
                        return TurnOutcome.confirm(confirm.intent(), confirm.message());
                    },
                    clarify -> {
                        analytics.intentClassified(session.id(), null, latency, true);
                        analytics.clarificationRequested(session.id(), clarify.suggestions());
                        return TurnOutcome.clarify(clarify.message(), clarify.suggestions());
                    },
                    error -> {
                        analytics.intentClassified(session.id(), null, latency, false);
                        analytics.errorOccurred(session.id(), error.kind(), error.recoverable(), error.message());
                        return TurnOutcome.error(error.message(), error.kind(), error.recoverable(),
                                error.kind().defaultRecovery(), null);
                    });

            commit(session, token, input, outcome);
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private TurnOutcome handleRoute(ConversationSession session, ClassificationResult.Route route,
                                    SessionContext snapshot) {
        ParsedIntent intent = route.intent();
        RoutingDecision decision = routing.decide(route, snapshot);
        if (!decision.shouldNavigate()) {
            analytics.errorOccurred(session.id(), decision.errorKind(), true, decision.message());
            return TurnOutcome.error(decision.message(), decision.errorKind(), true, decision.recovery(), intent);
        }

        String raw;
        try {
            raw = actionHandler.respond(intent, decision.target(), snapshot);
        } catch (RuntimeException e) {
            NavCaddyError error = NavCaddyError.fromThrowable(e);
            log.error("Action for {} failed: {}", intent.intentType(), error.message(), e);
            analytics.errorOccurred(session.id(), error.kind(), error.recoverable(), error.message());
            return TurnOutcome.error(ErrorMessages.forResponse(error.kind()), error.kind(), error.recoverable(),
                    error.recovery(), intent);
        }

        List<MissPattern> relevant = PATTERN_INTENTS.contains(intent.intentType())
                ? patterns.findPatterns(intent.entities().club())
                : List.of();
        var options = new FormatOptions(!relevant.isEmpty(),
                intent.entities().hasPain() ? DisclaimerType.MEDICAL : null);
        FormattedResponse formatted = formatter.format(raw, relevant, options);

        RoutingTarget target = decision.target();
        analytics.routeExecuted(session.id(), target);
        return TurnOutcome.routed(intent, target, formatted);
    }

    /**
     * Appends the exchange unless the turn was superseded. Failed turns are not remembered.
     */
    private void commit(ConversationSession session, CancellationToken token, String input, TurnOutcome outcome) {
        session.commit(token, () -> {
            if (outcome.isError() || input == null || input.isBlank()) {
                return;
            }
            session.store().appendTurn(input, outcome.message());
            if (outcome.outcome() == TurnOutcome.Outcome.ROUTE
                    && outcome.intent().intentType() == IntentType.SHOT_RECOMMENDATION) {
                session.store().recordRecommendation(outcome.message());
            }
        });
    }
}

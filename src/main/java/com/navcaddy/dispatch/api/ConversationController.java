package com.navcaddy.dispatch.api;

import com.navcaddy.core.classifier.ClassificationCancelledException;
import com.navcaddy.core.context.ContextInjector;
import com.navcaddy.core.engine.ConversationEngine;
import com.navcaddy.core.engine.TurnOutcome;
import com.navcaddy.core.engine.UnknownSessionException;
import com.navcaddy.core.events.InputType;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * REST controller for conversation sessions and turns.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationEngine engine;
    private final ContextInjector contextInjector;
    private final SessionEventStream eventStream;

    public ConversationController(ConversationEngine engine, ContextInjector contextInjector,
                                  SessionEventStream eventStream) {
        this.engine = engine;
        this.contextInjector = contextInjector;
        this.eventStream = eventStream;
    }

    /**
     * POST /api/v1/sessions — Start a session.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> startSession() {
        String sessionId = engine.startSession();
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionResponse(sessionId));
    }

    /**
     * POST /api/v1/sessions/{id}/turns — Run one user input through the pipeline and wait for the outcome.
     * Returns 409 when a newer input for the same session superseded this one.
     */
    @PostMapping("/{id}/turns")
    public ResponseEntity<?> submitTurn(@PathVariable String id, @RequestBody TurnRequest request) {
        InputType inputType;
        try {
            inputType = request.inputType() != null
                    ? InputType.valueOf(request.inputType().toUpperCase(Locale.ROOT))
                    : InputType.TEXT;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid input_type: " + request.inputType()));
        }

        try {
            String input = request.input() == null ? "" : request.input();
            TurnOutcome outcome = engine.submit(id, input, inputType).join();
            return ResponseEntity.ok(TurnResponse.from(outcome));
        } catch (UnknownSessionException e) {
            return notFound(id);
        } catch (ClassificationCancelledException e) {
            return superseded(id);
        } catch (CompletionException e) {
            if (e.getCause() instanceof ClassificationCancelledException) {
                return superseded(id);
            }
            throw e;
        }
    }

    /**
     * POST /api/v1/sessions/{id}/suggestions — The user picked a clarification suggestion.
     */
    @PostMapping("/{id}/suggestions")
    public ResponseEntity<?> selectSuggestion(@PathVariable String id, @RequestBody SuggestionRequest request) {
        IntentType intentType;
        try {
            intentType = IntentType.valueOf(String.valueOf(request.intentType()).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid intent_type: " + request.intentType()));
        }
        try {
            return ResponseEntity.ok(TurnResponse.from(engine.selectSuggestion(id, intentType)));
        } catch (UnknownSessionException e) {
            return notFound(id);
        } catch (ClassificationCancelledException e) {
            return superseded(id);
        }
    }

    /**
     * PUT /api/v1/sessions/{id}/round — Start or update the round being played.
     */
    @PutMapping("/{id}/round")
    public ResponseEntity<?> updateRound(@PathVariable String id, @RequestBody RoundRequest request) {
        if (request.roundId() == null || request.roundId().isBlank()
                || request.courseName() == null || request.courseName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "round_id and course_name are required"));
        }
        try {
            engine.updateRound(id, request.roundId(), request.courseName(),
                    request.hole() != null ? request.hole() : 1,
                    request.par() != null ? request.par() : 4);
            return ResponseEntity.ok(contextOf(id));
        } catch (UnknownSessionException e) {
            return notFound(id);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/sessions/{id}/context — Current context summary, prompt block and hints.
     */
    @GetMapping("/{id}/context")
    public ResponseEntity<?> getContext(@PathVariable String id) {
        try {
            return ResponseEntity.ok(contextOf(id));
        } catch (UnknownSessionException e) {
            return notFound(id);
        }
    }

    /**
     * GET /api/v1/sessions/{id}/events — Server-sent stream of the session's analytics events,
     * closed when the session ends.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        try {
            engine.snapshot(id);
        } catch (UnknownSessionException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown session: " + id);
        }
        return eventStream.open(id);
    }

    /**
     * DELETE /api/v1/sessions/{id} — End the session and clear its context.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> endSession(@PathVariable String id) {
        return engine.endSession(id) ? ResponseEntity.noContent().build() : notFound(id);
    }

    private ContextResponse contextOf(String id) {
        SessionContext context = engine.snapshot(id);
        return new ContextResponse(id,
                contextInjector.buildSummary(context),
                contextInjector.buildPrompt(context),
                contextInjector.extractContextHints(context));
    }

    private static ResponseEntity<Map<String, String>> superseded(String id) {
        log.info("Turn for session {} superseded", id);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Superseded by a newer input"));
    }

    private static ResponseEntity<Map<String, String>> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Unknown session: " + id));
    }
}

package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.navcaddy.core.classifier.ClassificationCancelledException;
import com.navcaddy.core.context.ContextInjector;
import com.navcaddy.core.engine.ConversationEngine;
import com.navcaddy.core.engine.TurnOutcome;
import com.navcaddy.core.engine.UnknownSessionException;
import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.error.ErrorMessages;
import com.navcaddy.core.events.InputType;
import com.navcaddy.core.model.Club;
import com.navcaddy.core.model.ClubType;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.Module;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.persona.DisclaimerType;
import com.navcaddy.core.persona.FormattedResponse;
import com.navcaddy.core.error.RecoveryAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConversationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ConversationEngine engine;

    @MockitoBean
    private ContextInjector contextInjector;

    @MockitoBean
    private SessionEventStream eventStream;

    private static TurnOutcome routedClubAdjustment() {
        var club = new Club("7-Iron", ClubType.IRON, 34, 150);
        var entities = new ExtractedEntities(club, null, null, null, null, null, null, null);
        var target = new RoutingTarget(Module.CADDY, "ClubAdjustmentScreen", Map.of("club", "7-Iron"));
        var intent = new ParsedIntent(IntentType.CLUB_ADJUSTMENT, 0.85, entities, null, target);
        return TurnOutcome.routed(intent, target,
                new FormattedResponse("Let's dial in your 7-Iron.", false, null, 0));
    }

    // ── POST /api/v1/sessions ────────────────────────────────────────

    @Test
    @DisplayName("POST /sessions returns 201 with session_id")
    void startSession() throws Exception {
        when(engine.startSession()).thenReturn("S-1");

        mockMvc.perform(post("/api/v1/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session_id").value("S-1"));
    }

    // ── POST /api/v1/sessions/{id}/turns ─────────────────────────────

    @Test
    @DisplayName("POST /turns returns the routed outcome")
    void submitTurnRoute() throws Exception {
        when(engine.submit("S-1", "My 7i feels long today", InputType.VOICE))
                .thenReturn(CompletableFuture.completedFuture(routedClubAdjustment()));

        String body = objectMapper.writeValueAsString(new TurnRequest("My 7i feels long today", "voice"));

        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ROUTE"))
                .andExpect(jsonPath("$.intent").value("CLUB_ADJUSTMENT"))
                .andExpect(jsonPath("$.confidence").value(0.85))
                .andExpect(jsonPath("$.target.module").value("CADDY"))
                .andExpect(jsonPath("$.target.screen").value("ClubAdjustmentScreen"))
                .andExpect(jsonPath("$.target.parameters.club").value("7-Iron"))
                .andExpect(jsonPath("$.disclaimer_added").value(false))
                .andExpect(jsonPath("$.suggestions", hasSize(0)));
    }

    @Test
    @DisplayName("POST /turns returns clarification suggestions")
    void submitTurnClarify() throws Exception {
        var outcome = TurnOutcome.clarify("I'm not sure what you're referring to.", List.of(
                new IntentSuggestion(IntentType.CLUB_ADJUSTMENT, "Adjust Club", "Adjust club distances"),
                new IntentSuggestion(IntentType.RECOVERY_CHECK, "Check Recovery", "Check recovery status")));
        when(engine.submit(eq("S-1"), anyString(), eq(InputType.TEXT)))
                .thenReturn(CompletableFuture.completedFuture(outcome));

        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"It feels off today\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("CLARIFY"))
                .andExpect(jsonPath("$.suggestions", hasSize(2)))
                .andExpect(jsonPath("$.suggestions[0].intent_type").value("CLUB_ADJUSTMENT"))
                .andExpect(jsonPath("$.suggestions[0].label").value("Adjust Club"));
    }

    @Test
    @DisplayName("POST /turns reports a disclaimer")
    void submitTurnDisclaimer() throws Exception {
        var intent = new ParsedIntent(IntentType.DRILL_REQUEST, 0.9, null, null, null);
        var outcome = TurnOutcome.routed(intent, new RoutingTarget(Module.COACH, "DrillScreen"),
                new FormattedResponse("This may help with your slice" + DisclaimerType.SAFETY.block(), true,
                        DisclaimerType.SAFETY, 0));
        when(engine.submit(eq("S-1"), anyString(), any())).thenReturn(CompletableFuture.completedFuture(outcome));

        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"fix my slice\"}"))
                .andExpect(jsonPath("$.disclaimer_added").value(true))
                .andExpect(jsonPath("$.disclaimer_type").value("SAFETY"))
                .andExpect(jsonPath("$.message", containsString("Results may vary")));
    }

    @Test
    @DisplayName("POST /turns returns an error outcome with 200")
    void submitTurnError() throws Exception {
        var outcome = TurnOutcome.error(ErrorMessages.INPUT_EMPTY, ErrorKind.INPUT_EMPTY, true,
                RecoveryAction.REPHRASE, null);
        when(engine.submit(eq("S-1"), eq(""), any())).thenReturn(CompletableFuture.completedFuture(outcome));

        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ERROR"))
                .andExpect(jsonPath("$.error_kind").value("INPUT_EMPTY"))
                .andExpect(jsonPath("$.recoverable").value(true))
                .andExpect(jsonPath("$.recovery").value("REPHRASE"))
                .andExpect(jsonPath("$.intent").doesNotExist());
    }

    @Test
    @DisplayName("POST /turns with invalid input_type returns 400")
    void submitTurnBadInputType() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"hi\",\"input_type\":\"SMOKE_SIGNAL\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("SMOKE_SIGNAL")));
        verify(engine, never()).submit(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("POST /turns for an unknown session returns 404")
    void submitTurnUnknownSession() throws Exception {
        when(engine.submit(eq("nope"), anyString(), any())).thenThrow(new UnknownSessionException("nope"));

        mockMvc.perform(post("/api/v1/sessions/nope/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"hi\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown session: nope"));
    }

    @Test
    @DisplayName("POST /turns superseded by a newer input returns 409")
    void submitTurnSuperseded() throws Exception {
        when(engine.submit(eq("S-1"), anyString(), any())).thenReturn(
                CompletableFuture.failedFuture(new ClassificationCancelledException("Superseded by a newer input")));

        mockMvc.perform(post("/api/v1/sessions/S-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"first\"}"))
                .andExpect(status().isConflict());
    }

    // ── POST /api/v1/sessions/{id}/suggestions ───────────────────────

    @Test
    @DisplayName("POST /suggestions runs the picked intent")
    void selectSuggestion() throws Exception {
        var intent = new ParsedIntent(IntentType.DRILL_REQUEST, 1.0, null, null, null);
        when(engine.selectSuggestion("S-1", IntentType.DRILL_REQUEST)).thenReturn(
                TurnOutcome.routed(intent, new RoutingTarget(Module.COACH, "DrillScreen"),
                        new FormattedResponse("Here are a few drills.", false, null, 0)));

        mockMvc.perform(post("/api/v1/sessions/S-1/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intent_type\":\"drill_request\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("DRILL_REQUEST"))
                .andExpect(jsonPath("$.confidence").value(1.0));
    }

    @Test
    @DisplayName("POST /suggestions with an unknown intent returns 400")
    void selectSuggestionBadIntent() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/S-1/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intent_type\":\"TEE_TIME\"}"))
                .andExpect(status().isBadRequest());
    }

    // ── PUT /api/v1/sessions/{id}/round ──────────────────────────────

    @Test
    @DisplayName("PUT /round updates the round and returns the context")
    void updateRound() throws Exception {
        when(engine.snapshot("S-1")).thenReturn(SessionContext.empty());
        when(contextInjector.buildSummary(any())).thenReturn("Playing Pebble Beach, hole 7 (par 3).");
        when(contextInjector.buildPrompt(any())).thenReturn("# Current Round\n- Course: Pebble Beach");
        when(contextInjector.extractContextHints(any())).thenReturn(Map.of("course", "Pebble Beach"));

        mockMvc.perform(put("/api/v1/sessions/S-1/round")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"round_id\":\"R-1\",\"course_name\":\"Pebble Beach\",\"hole\":7,\"par\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("S-1"))
                .andExpect(jsonPath("$.summary").value("Playing Pebble Beach, hole 7 (par 3)."))
                .andExpect(jsonPath("$.hints.course").value("Pebble Beach"));
        verify(engine).updateRound("S-1", "R-1", "Pebble Beach", 7, 3);
    }

    @Test
    @DisplayName("PUT /round without a course returns 400")
    void updateRoundMissingCourse() throws Exception {
        mockMvc.perform(put("/api/v1/sessions/S-1/round")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"round_id\":\"R-1\"}"))
                .andExpect(status().isBadRequest());
        verify(engine, never()).updateRound(anyString(), anyString(), anyString(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("PUT /round with an invalid hole returns 400")
    void updateRoundBadHole() throws Exception {
        doThrow(new IllegalArgumentException("hole must be within 1..18 but was 19"))
                .when(engine).updateRound("S-1", "R-1", "Pebble Beach", 19, 4);

        mockMvc.perform(put("/api/v1/sessions/S-1/round")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"round_id\":\"R-1\",\"course_name\":\"Pebble Beach\",\"hole\":19}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("1..18")));
    }

    // ── GET / DELETE ─────────────────────────────────────────────────

    @Test
    @DisplayName("GET /context for an unknown session returns 404")
    void contextUnknownSession() throws Exception {
        when(engine.snapshot("nope")).thenThrow(new UnknownSessionException("nope"));

        mockMvc.perform(get("/api/v1/sessions/nope/context"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /sessions/{id} returns 204, then 404")
    void endSession() throws Exception {
        when(engine.endSession("S-1")).thenReturn(true);
        when(engine.endSession("S-2")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/sessions/S-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/sessions/S-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /events opens a server-sent stream for a live session")
    void streamEvents() throws Exception {
        when(engine.snapshot("S-1")).thenReturn(SessionContext.empty());
        when(eventStream.open("S-1")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/sessions/S-1/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
        verify(eventStream).open("S-1");
    }

    @Test
    @DisplayName("GET /events for an unknown session returns 404 without subscribing")
    void streamEventsUnknownSession() throws Exception {
        when(engine.snapshot("nope")).thenThrow(new UnknownSessionException("nope"));

        mockMvc.perform(get("/api/v1/sessions/nope/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isNotFound());
        verify(eventStream, never()).open(anyString());
    }
}

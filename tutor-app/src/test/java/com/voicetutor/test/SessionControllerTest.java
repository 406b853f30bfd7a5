package com.voicetutor.test;

import com.voicetutor.test.support.TutorEngineFixture;
import com.voicetutor.trigger.application.command.SessionCommandService;
import com.voicetutor.trigger.application.common.SessionDtoAssembler;
import com.voicetutor.trigger.application.query.SessionQueryService;
import com.voicetutor.trigger.http.GlobalApiExceptionHandler;
import com.voicetutor.trigger.http.HealthController;
import com.voicetutor.trigger.http.LearningEntryController;
import com.voicetutor.trigger.http.SessionController;
import com.voicetutor.trigger.http.SessionEventController;
import com.voicetutor.types.enums.ResponseCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionControllerTest {

    private TutorEngineFixture fixture;
    private SessionCommandService sessionCommandService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.fixture = new TutorEngineFixture();
        this.sessionCommandService = fixture.sessionCommandService();
        SessionQueryService sessionQueryService = fixture.sessionQueryService();
        SessionDtoAssembler assembler = new SessionDtoAssembler();
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new SessionController(sessionCommandService, sessionQueryService, assembler),
                        new SessionEventController(fixture.eventCommandService(), assembler),
                        new LearningEntryController(sessionQueryService, assembler),
                        new HealthController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldCreateSessionWithDiagnoseQuiz() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entry_id\":\"" + TutorEngineFixture.ENTRY_ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.sessionId", startsWith("S_")))
                .andExpect(jsonPath("$.data.state.entryId").value(TutorEngineFixture.ENTRY_ID))
                .andExpect(jsonPath("$.data.state.beat").value("ColdOpen"))
                .andExpect(jsonPath("$.data.state.availableRoles", hasSize(3)))
                .andExpect(jsonPath("$.data.diagnose", hasSize(2)))
                .andExpect(jsonPath("$.data.diagnose[0].questionId").value("diag_q1"));
    }

    @Test
    public void shouldReturnNotFoundForUnknownEntry() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entryId\":\"quantum_physics\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.ENTRY_NOT_FOUND.getCode()));
    }

    @Test
    public void shouldRejectMissingEntryId() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldExposeSnapshotTimelineAndInstructions() throws Exception {
        String sessionId = sessionCommandService.openSession(TutorEngineFixture.ENTRY_ID).state().getSessionId();

        mockMvc.perform(get("/api/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value(sessionId))
                .andExpect(jsonPath("$.data.outputClockSec").value(0))
                .andExpect(jsonPath("$.data.turns", hasSize(0)));

        mockMvc.perform(get("/api/sessions/" + sessionId + "/timeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].seq").value(1))
                .andExpect(jsonPath("$.data[0].type").value("session_started"));

        mockMvc.perform(get("/api/sessions/" + sessionId + "/instructions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fallback").value(false))
                .andExpect(jsonPath("$.data.instructions", containsString("机会成本")));
    }

    @Test
    public void shouldStayReplayConsistentAfterEvents() throws Exception {
        String sessionId = sessionCommandService.openSession(TutorEngineFixture.ENTRY_ID).state().getSessionId();
        fixture.clock.advance(Duration.ofSeconds(20));

        mockMvc.perform(post("/api/sessions/" + sessionId + "/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"evt-1\",\"text\":\"机会成本就是放弃的东西吗\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.debug.userSeq").value(2))
                .andExpect(jsonPath("$.data.debug.replySeq").value(4))
                .andExpect(jsonPath("$.data.debug.duplicate").value(false));

        mockMvc.perform(post("/api/sessions/" + sessionId + "/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"evt-1\",\"text\":\"机会成本就是放弃的东西吗\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.debug.replySeq").value(4))
                .andExpect(jsonPath("$.data.debug.duplicate").value(true));

        mockMvc.perform(get("/api/sessions/" + sessionId + "/timeline"))
                .andExpect(jsonPath("$.data", hasSize(4)))
                .andExpect(jsonPath("$.data[2].type").value("director_plan"))
                .andExpect(jsonPath("$.data[3].type").value("assistant_text"));

        mockMvc.perform(get("/api/sessions/" + sessionId + "/replay"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.eventCount").value(4))
                .andExpect(jsonPath("$.data.consistent").value(true));
    }

    @Test
    public void shouldReturnNotFoundForUnknownSession() throws Exception {
        mockMvc.perform(get("/api/sessions/S_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.SESSION_NOT_FOUND.getCode()));

        mockMvc.perform(get("/api/sessions/S_missing/replay"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void shouldListEntriesAndReportHealth() throws Exception {
        mockMvc.perform(get("/api/entries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].entryId").value(TutorEngineFixture.ENTRY_ID))
                .andExpect(jsonPath("$.data[0].title").value("机会成本"));

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ok"));
    }
}

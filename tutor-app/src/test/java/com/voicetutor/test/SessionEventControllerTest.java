package com.voicetutor.test;

import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.trigger.application.command.SessionEventCommandService;
import com.voicetutor.trigger.application.common.SessionDtoAssembler;
import com.voicetutor.trigger.http.GlobalApiExceptionHandler;
import com.voicetutor.trigger.http.SessionEventController;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionEventControllerTest {

    private MockMvc mockMvc;
    private SessionEventCommandService sessionEventCommandService;

    @BeforeEach
    public void setUp() {
        this.sessionEventCommandService = mock(SessionEventCommandService.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new SessionEventController(sessionEventCommandService, new SessionDtoAssembler()))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldSubmitEventAndReturnAssistantReply() throws Exception {
        when(sessionEventCommandService.onEvent(eq("S1"), any(TimelineEventEntity.class))).thenReturn(result());

        mockMvc.perform(post("/api/sessions/S1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"evt-1\",\"turn_id\":\"t-1\",\"type\":\"user_message\","
                                + "\"text\":\"hello\",\"client_ts\":\"2026-03-02T10:00:30\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.assistant.text").value("先用一句话复述一下？"))
                .andExpect(jsonPath("$.data.assistant.needUserAction.type").value("teach_back"))
                .andExpect(jsonPath("$.data.debug.userSeq").value(2))
                .andExpect(jsonPath("$.data.debug.replySeq").value(4))
                .andExpect(jsonPath("$.data.debug.duplicate").value(false))
                .andExpect(jsonPath("$.data.debug.directorPlan.flowMode").value("RESCUE"))
                .andExpect(jsonPath("$.data.debug.directorPlan.nextBeat").value("check"))
                .andExpect(jsonPath("$.data.debug.directorPlan.outputAction").value("recap"))
                .andExpect(jsonPath("$.data.debug.directorPlan.debug.source").value("fallback"));

        ArgumentCaptor<TimelineEventEntity> captor = ArgumentCaptor.forClass(TimelineEventEntity.class);
        verify(sessionEventCommandService).onEvent(eq("S1"), captor.capture());
        TimelineEventEntity event = captor.getValue();
        assertEquals("evt-1", event.getEventId());
        assertEquals("t-1", event.getTurnId());
        assertEquals("user_message", event.getType());
        assertEquals("hello", event.getText());
        assertEquals(LocalDateTime.of(2026, 3, 2, 10, 0, 30), event.getClientTimestamp());
    }

    @Test
    public void shouldAcceptCamelCaseQuizAnswer() throws Exception {
        when(sessionEventCommandService.onEvent(eq("S1"), any(TimelineEventEntity.class))).thenReturn(result());

        mockMvc.perform(post("/api/sessions/S1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventId\":\"quiz-1\",\"type\":\"quiz_answer\",\"questionId\":\"diag_q1\",\"answer\":\"B\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<TimelineEventEntity> captor = ArgumentCaptor.forClass(TimelineEventEntity.class);
        verify(sessionEventCommandService).onEvent(eq("S1"), captor.capture());
        assertEquals("diag_q1", captor.getValue().getQuestionId());
        assertEquals("B", captor.getValue().getAnswer());
    }

    @Test
    public void shouldReturnNotFoundForUnknownSession() throws Exception {
        when(sessionEventCommandService.onEvent(eq("S_missing"), any(TimelineEventEntity.class)))
                .thenThrow(new AppException(ResponseCode.SESSION_NOT_FOUND, "会话不存在: S_missing"));

        mockMvc.perform(post("/api/sessions/S_missing/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"evt-1\",\"text\":\"hello\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.SESSION_NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("会话不存在: S_missing"));
    }

    @Test
    public void shouldReturnServerErrorOnStoreFailure() throws Exception {
        when(sessionEventCommandService.onEvent(eq("S1"), any(TimelineEventEntity.class)))
                .thenThrow(new AppException(ResponseCode.STORE_FAILURE, "事件落盘失败: disk full"));

        mockMvc.perform(post("/api/sessions/S1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"evt-1\",\"text\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(ResponseCode.STORE_FAILURE.getCode()));
    }

    @Test
    public void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/sessions/S1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));

        verify(sessionEventCommandService, never()).onEvent(any(), any());
    }

    private SessionEventCommandService.SessionEventResult result() {
        SessionStateEntity state = new SessionStateEntity();
        state.setSessionId("S1");
        DirectorPlan plan = new DirectorPolicyDomainService().fallbackPlan(state, DirectorSettings.defaults(), "timeout");

        SessionEventCommandService.SessionEventResult result = new SessionEventCommandService.SessionEventResult();
        result.setSessionId("S1");
        result.setTurnId("t-1");
        result.setUserSeq(2L);
        result.setPlanSeq(3L);
        result.setReplySeq(4L);
        result.setPlan(plan);
        result.setNeedUserAction(plan.getUserMustDo());
        result.setAssistantText("先用一句话复述一下？");
        return result;
    }
}

package com.voicetutor.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicetutor.config.ThreadPoolConfig;
import com.voicetutor.domain.director.adapter.gateway.IDirectorDecisionGateway;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.director.service.DirectorPromptDomainService;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.infrastructure.director.DelegatedDirectorServiceImpl;
import com.voicetutor.infrastructure.util.JsonCodec;
import com.voicetutor.types.enums.EventTypeEnum;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import com.voicetutor.types.enums.StackActionEnum;
import com.voicetutor.types.enums.UserMustDoTypeEnum;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DelegatedDirectorServiceTest {

    private IDirectorDecisionGateway gateway;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private DirectorSettings settings;
    private SessionStateEntity state;

    @BeforeEach
    public void setUp() {
        this.gateway = mock(IDirectorDecisionGateway.class);
        this.meterRegistry = new SimpleMeterRegistry();
        this.executor = Executors.newSingleThreadExecutor();
        this.settings = DirectorSettings.defaults();
        this.state = new SessionStateEntity();
        state.setSessionId("S1");
        state.setMainObjective("机会成本");
        state.setAvailableRoles(List.of("host", "economist", "skeptic"));
        state.setMasteryEstimate(0.5D);
        state.setTensionLevel(5);
        state.setCognitiveLoad(5);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldParseDecisionEmbeddedInProse() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn("好的，计划如下：\n{"
                + "\"flow_mode\":\"FLOW\","
                + "\"user_mind_state\":[\"Partial\",\"verify\"],"
                + "\"intent\":\"Deepen\","
                + "\"next_beat\":\"deepen\","
                + "\"next_role\":\"economist\","
                + "\"output_action\":\"ask_elaboration\","
                + "\"talk_burst_limit_sec\":18,"
                + "\"tension_goal\":\"maintain\","
                + "\"load_goal\":\"decrease\","
                + "\"stack_action\":\"keep\","
                + "\"notes\":\"go deeper\"}\n以上。");

        DirectorPlan plan = service(0L).decide(state, message("为什么放弃的也算？"), settings);

        assertEquals(FlowModeEnum.FLOW, plan.getFlowMode());
        assertEquals(List.of(MindStateEnum.PARTIAL, MindStateEnum.VERIFY), plan.getUserMindState());
        assertEquals(IntentEnum.DEEPEN, plan.getIntent());
        assertEquals("deepen", plan.getNextBeat());
        assertEquals("economist", plan.getNextRole());
        assertEquals(OutputActionEnum.ASK_ELABORATION, plan.getOutputAction());
        assertEquals(UserMustDoTypeEnum.EXAMPLE, plan.getUserMustDo().getType());
        assertEquals(18, plan.getTalkBurstLimitSec());
        assertEquals(GoalDirectionEnum.KEEP, plan.getTensionGoal());
        assertEquals(GoalDirectionEnum.DECREASE, plan.getLoadGoal());
        assertEquals(StackActionEnum.KEEP, plan.getStackAction());
        assertEquals(DirectorPolicyDomainService.SOURCE_DELEGATED, plan.getDebug().getSource());
        assertTrue(plan.getDebug().getGuardrailNotes().isEmpty());
    }

    @Test
    public void shouldSendRulesAndStatePanelToGateway() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn("{}");

        service(0L).decide(state, message("为什么放弃的也算？"), settings);

        ArgumentCaptor<String> systemPrompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(gateway).requestDecision(systemPrompt.capture(), userPrompt.capture());
        assertTrue(systemPrompt.getValue().contains("next_beat"));
        assertTrue(userPrompt.getValue().contains("机会成本"));
        assertTrue(userPrompt.getValue().contains("为什么放弃的也算？"));
    }

    @Test
    public void shouldApplyGuardrailsToDelegatedDecision() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn(
                "{\"flow_mode\":\"FLOW\",\"next_beat\":\"lecture\",\"next_role\":\"narrator\",\"talk_burst_limit_sec\":45}");

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertEquals("check", plan.getNextBeat());
        assertEquals("host", plan.getNextRole());
        assertEquals(20, plan.getTalkBurstLimitSec());
        assertEquals(2, plan.getDebug().getGuardrailNotes().size());
    }

    @Test
    public void shouldFallBackOnMalformedOutput() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn("我觉得下一步应该深入讲解。");

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertFallback(plan, DelegatedDirectorServiceImpl.REASON_MALFORMED_OUTPUT);
        assertEquals(1.0D, meterRegistry.counter("tutor.director.fallback.total", "reason", "malformed_output").count());
    }

    @Test
    public void shouldFallBackWhenRequiredFieldIsMissing() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn("{\"next_beat\":\"check\",\"next_role\":\"host\"}");

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertFallback(plan, DelegatedDirectorServiceImpl.REASON_MALFORMED_OUTPUT);
    }

    @Test
    public void shouldFallBackOnIllegalOutputAction() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn(
                "{\"flow_mode\":\"RESCUE\",\"next_beat\":\"check\",\"next_role\":\"host\",\"output_action\":\"sing\"}");

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertFallback(plan, DelegatedDirectorServiceImpl.REASON_MALFORMED_OUTPUT);
    }

    @Test
    public void shouldFallBackOnProviderError() {
        when(gateway.requestDecision(anyString(), anyString())).thenThrow(new IllegalStateException("503 from provider"));

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertFallback(plan, DelegatedDirectorServiceImpl.REASON_PROVIDER_ERROR);
    }

    @Test
    public void shouldFallBackOnSoftTimeout() {
        when(gateway.requestDecision(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2000L);
            return "{\"flow_mode\":\"FLOW\",\"next_beat\":\"check\",\"next_role\":\"host\"}";
        });

        long startedAt = System.currentTimeMillis();
        DirectorPlan plan = service(100L).decide(state, message("继续"), settings);

        assertFallback(plan, DelegatedDirectorServiceImpl.REASON_TIMEOUT);
        assertTrue(System.currentTimeMillis() - startedAt < 1500L);
        assertEquals(1.0D, meterRegistry.counter("tutor.director.fallback.total", "reason", "timeout").count());
    }

    @Test
    public void shouldFallBackWithinTimeoutWhenDelegatePoolIsSaturated() throws Exception {
        ThreadPoolExecutor pool = new ThreadPoolConfig().tutorDelegateExecutor(1, 1, 60L, 0, "CallerRunsPolicy", "delegate-test-");
        CountDownLatch release = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });
            when(gateway.requestDecision(anyString(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(3000L);
                return "{\"flow_mode\":\"FLOW\",\"next_beat\":\"check\",\"next_role\":\"host\"}";
            });

            long startedAt = System.currentTimeMillis();
            DirectorPlan plan = service(pool, 200L).decide(state, message("继续"), settings);

            assertTrue(System.currentTimeMillis() - startedAt < 1500L);
            assertFallback(plan, DelegatedDirectorServiceImpl.REASON_PROVIDER_ERROR);
            verify(gateway, never()).requestDecision(anyString(), anyString());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    public void shouldTreatOverflowingTalkBurstAsMissing() {
        when(gateway.requestDecision(anyString(), anyString())).thenReturn(
                "{\"flow_mode\":\"FLOW\",\"next_beat\":\"check\",\"next_role\":\"host\","
                        + "\"talk_burst_limit_sec\":\"99999999999\"}");

        DirectorPlan plan = service(0L).decide(state, message("继续"), settings);

        assertEquals(DirectorPolicyDomainService.SOURCE_DELEGATED, plan.getDebug().getSource());
        assertEquals(20, plan.getTalkBurstLimitSec());
    }

    private void assertFallback(DirectorPlan plan, String reason) {
        assertEquals(DirectorPolicyDomainService.SOURCE_FALLBACK, plan.getDebug().getSource());
        assertEquals(reason, plan.getDebug().getFallbackReason());
        assertEquals(FlowModeEnum.RESCUE, plan.getFlowMode());
        assertEquals("check", plan.getNextBeat());
        assertEquals("host", plan.getNextRole());
        assertEquals(OutputActionEnum.RECAP, plan.getOutputAction());
        assertEquals(UserMustDoTypeEnum.TEACH_BACK, plan.getUserMustDo().getType());
    }

    private DelegatedDirectorServiceImpl service(long softTimeoutMs) {
        return service(executor, softTimeoutMs);
    }

    private DelegatedDirectorServiceImpl service(ExecutorService pool, long softTimeoutMs) {
        return new DelegatedDirectorServiceImpl(gateway,
                new DirectorPolicyDomainService(),
                new DirectorPromptDomainService(),
                new JsonCodec(new ObjectMapper()),
                pool,
                softTimeoutMs,
                meterRegistry);
    }

    private TimelineEventEntity message(String text) {
        return TimelineEventEntity.of(EventTypeEnum.USER_MESSAGE, text);
    }
}

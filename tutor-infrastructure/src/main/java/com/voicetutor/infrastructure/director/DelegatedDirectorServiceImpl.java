package com.voicetutor.infrastructure.director;

import com.voicetutor.domain.director.adapter.gateway.IDirectorDecisionGateway;
import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorDebug;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.model.valobj.UserMustDo;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.director.service.DirectorPromptDomainService;
import com.voicetutor.domain.director.service.DirectorService;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.infrastructure.ai.SoftTimeoutInvoker;
import com.voicetutor.infrastructure.util.JsonCodec;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.enums.StackActionEnum;
import com.voicetutor.types.enums.UserMustDoTypeEnum;
import com.voicetutor.types.exception.AppException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * 委托外部模型的导演实现。
 * <p>
 * 规则推断结果作为参考写入提示词，模型返回 JSON 计划后再经过同一组护栏；
 * 超时、调用失败或输出无法解析时返回兜底计划，并记录 tutor.director.fallback.total。
 * </p>
 */
@Slf4j
public class DelegatedDirectorServiceImpl implements DirectorService {

    private static final String METRIC_DIRECTOR_DECISION_TOTAL = "tutor.director.decision.total";
    private static final String METRIC_DIRECTOR_FALLBACK_TOTAL = "tutor.director.fallback.total";

    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_PROVIDER_ERROR = "provider_error";
    public static final String REASON_MALFORMED_OUTPUT = "malformed_output";
    public static final String REASON_INTERNAL_ERROR = "internal_error";

    private final IDirectorDecisionGateway decisionGateway;
    private final DirectorPolicyDomainService policy;
    private final DirectorPromptDomainService promptService;
    private final JsonCodec jsonCodec;
    private final ExecutorService executor;
    private final long softTimeoutMs;
    private final MeterRegistry meterRegistry;

    public DelegatedDirectorServiceImpl(IDirectorDecisionGateway decisionGateway,
                                        DirectorPolicyDomainService policy,
                                        DirectorPromptDomainService promptService,
                                        JsonCodec jsonCodec,
                                        ExecutorService executor,
                                        long softTimeoutMs) {
        this(decisionGateway, policy, promptService, jsonCodec, executor, softTimeoutMs, Metrics.globalRegistry);
    }

    public DelegatedDirectorServiceImpl(IDirectorDecisionGateway decisionGateway,
                                        DirectorPolicyDomainService policy,
                                        DirectorPromptDomainService promptService,
                                        JsonCodec jsonCodec,
                                        ExecutorService executor,
                                        long softTimeoutMs,
                                        MeterRegistry meterRegistry) {
        this.decisionGateway = decisionGateway;
        this.policy = policy;
        this.promptService = promptService;
        this.jsonCodec = jsonCodec;
        this.executor = executor;
        this.softTimeoutMs = Math.max(softTimeoutMs, 0L);
        this.meterRegistry = meterRegistry == null ? Metrics.globalRegistry : meterRegistry;
    }

    @Override
    public DirectorPlan decide(SessionStateEntity snapshot, TimelineEventEntity event, DirectorSettings settings) {
        String sessionId = snapshot.getSessionId();
        try {
            String userText = event == null ? "" : event.userText();
            FlowModeEnum flowMode = policy.inferFlowMode(snapshot, userText, settings);
            List<MindStateEnum> mindStates = policy.inferMindStates(snapshot, userText);
            List<String> candidates = policy.beatCandidates(snapshot, flowMode, mindStates, settings);
            String systemPrompt = promptService.buildSystemPrompt(settings);
            String userPrompt = promptService.buildUserPrompt(snapshot, userText, flowMode, mindStates, candidates, settings);

            String content;
            try {
                content = SoftTimeoutInvoker.invoke(executor,
                        () -> decisionGateway.requestDecision(systemPrompt, userPrompt),
                        softTimeoutMs,
                        "Director decision");
            } catch (AppException ex) {
                return fallback(snapshot, settings, SoftTimeoutInvoker.isTimeout(ex) ? REASON_TIMEOUT : REASON_PROVIDER_ERROR, ex);
            }

            DirectorPlan plan;
            try {
                plan = parsePlan(content);
            } catch (AppException ex) {
                return fallback(snapshot, settings, REASON_MALFORMED_OUTPUT, ex);
            }

            DirectorDebug debug = new DirectorDebug();
            debug.setSource(DirectorPolicyDomainService.SOURCE_DELEGATED);
            debug.setBeatCandidates(candidates);
            debug.setBeatChoiceReason("delegated decision");
            debug.setRoleChoiceReason("delegated decision");
            plan.setDebug(debug);
            DirectorPlan guarded = policy.applyGuardrails(plan, snapshot, settings);
            meterRegistry.counter(METRIC_DIRECTOR_DECISION_TOTAL, "source", DirectorPolicyDomainService.SOURCE_DELEGATED).increment();
            log.info("DIRECTOR_DELEGATED_DECIDED sessionId={}, beat={}, role={}, action={}, guardrails={}",
                    sessionId,
                    guarded.getNextBeat(),
                    guarded.getNextRole(),
                    guarded.getOutputAction() == null ? null : guarded.getOutputAction().getCode(),
                    guarded.getDebug().getGuardrailNotes());
            return guarded;
        } catch (RuntimeException ex) {
            return fallback(snapshot, settings, REASON_INTERNAL_ERROR, ex);
        }
    }

    private DirectorPlan fallback(SessionStateEntity snapshot, DirectorSettings settings, String reason, Exception ex) {
        log.warn("DIRECTOR_FALLBACK sessionId={}, reason={}, error={}", snapshot.getSessionId(), reason, ex.getMessage());
        meterRegistry.counter(METRIC_DIRECTOR_FALLBACK_TOTAL, "reason", reason).increment();
        meterRegistry.counter(METRIC_DIRECTOR_DECISION_TOTAL, "source", DirectorPolicyDomainService.SOURCE_FALLBACK).increment();
        return policy.fallbackPlan(snapshot, settings, reason);
    }

    private DirectorPlan parsePlan(String content) {
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "导演决策返回为空");
        }
        Map<String, Object> payload = jsonCodec.readEmbeddedMap(content);
        if (payload == null) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "导演决策结果不是有效 JSON");
        }

        String nextBeat = requireString(payload, "next_beat", "nextBeat");
        String nextRole = requireString(payload, "next_role", "nextRole");
        FlowModeEnum flowMode = FlowModeEnum.fromCode(requireString(payload, "flow_mode", "flowMode"));
        if (flowMode == null) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "导演决策 flow_mode 取值非法");
        }
        OutputActionEnum outputAction = BeatLibrary.outputActionOf(nextBeat);
        String actionCode = getString(payload, "output_action", "outputAction");
        if (actionCode != null) {
            outputAction = OutputActionEnum.fromCode(actionCode);
            if (outputAction == null) {
                throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "导演决策 output_action 取值非法: " + actionCode);
            }
        }

        DirectorPlan plan = new DirectorPlan();
        plan.setNextBeat(nextBeat.trim());
        plan.setNextRole(nextRole.trim());
        plan.setFlowMode(flowMode);
        plan.setOutputAction(outputAction);
        plan.setUserMindState(parseMindStates(payload.get("user_mind_state")));
        plan.setIntent(IntentEnum.fromCode(getString(payload, "intent")));
        plan.setUserMustDo(parseUserMustDo(payload.get("user_must_do")));
        plan.setTalkBurstLimitSec(getInt(payload, "talk_burst_limit_sec", "talkBurstLimitSec"));
        plan.setTensionGoal(parseGoal(getString(payload, "tension_goal", "tensionGoal")));
        plan.setLoadGoal(parseGoal(getString(payload, "load_goal", "loadGoal")));
        plan.setStackAction(StackActionEnum.fromCode(getString(payload, "stack_action", "stackAction")));
        plan.setNotes(getString(payload, "notes"));
        return plan;
    }

    private List<MindStateEnum> parseMindStates(Object value) {
        List<MindStateEnum> states = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                MindStateEnum state = item == null ? null : MindStateEnum.fromCode(String.valueOf(item));
                if (state != null && !states.contains(state)) {
                    states.add(state);
                }
            }
        } else if (value != null) {
            MindStateEnum state = MindStateEnum.fromCode(String.valueOf(value));
            if (state != null) {
                states.add(state);
            }
        }
        return states;
    }

    @SuppressWarnings("unchecked")
    private UserMustDo parseUserMustDo(Object value) {
        if (!(value instanceof Map<?, ?>)) {
            return null;
        }
        Map<String, Object> map = (Map<String, Object>) value;
        UserMustDoTypeEnum type = UserMustDoTypeEnum.fromCode(getString(map, "type"));
        String prompt = getString(map, "prompt");
        if (type == null && prompt == null) {
            return null;
        }
        return new UserMustDo(type, prompt);
    }

    // 模型常用 maintain 表示保持
    private GoalDirectionEnum parseGoal(String value) {
        if ("maintain".equalsIgnoreCase(StringUtils.trimToEmpty(value))) {
            return GoalDirectionEnum.KEEP;
        }
        return GoalDirectionEnum.fromCode(value);
    }

    private String requireString(Map<String, Object> source, String... keys) {
        String value = getString(source, keys);
        if (value == null) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, "导演决策缺少字段: " + keys[0]);
        }
        return value;
    }

    private String getString(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            Object value = source.get(key);
            if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
                continue;
            }
            String text = String.valueOf(value);
            if (StringUtils.isNotBlank(text)) {
                return text;
            }
        }
        return null;
    }

    private int getInt(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value instanceof Number number) {
                return number.intValue();
            }
            if (value instanceof String text && StringUtils.isNotBlank(text)) {
                return NumberUtils.toInt(text.trim(), 0);
            }
        }
        return 0;
    }
}

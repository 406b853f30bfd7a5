package com.voicetutor.trigger.application.command;

import com.google.common.util.concurrent.Striped;
import com.voicetutor.domain.actor.adapter.gateway.IUtteranceGenerator;
import com.voicetutor.domain.actor.model.valobj.ActorPrompt;
import com.voicetutor.domain.actor.model.valobj.ActorSessionContext;
import com.voicetutor.domain.actor.model.valobj.UtteranceRequest;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.UserMustDo;
import com.voicetutor.domain.session.adapter.repository.ISessionStateRepository;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.service.SessionReducerDomainService;
import com.voicetutor.domain.timeline.adapter.repository.ITimelineRepository;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.trigger.application.common.DirectorDecisionSupport;
import com.voicetutor.types.enums.EventTypeEnum;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * 会话事件写用例：一次入站事件驱动一轮完整编排。
 * <p>
 * 顺序固定为：用户事件落时间线并归约 → 导演计划落时间线并归约 → 组装指令并生成回复 → 助手回复落时间线并归约。
 * 每次追加与快照保存各自提交，没有跨仓储事务；同一会话的事件由分段锁串行处理。
 * </p>
 */
@Slf4j
@Service
public class SessionEventCommandService {

    public static final String PLAN_EVENT_SUFFIX = "#plan";
    public static final String REPLY_EVENT_SUFFIX = "#reply";
    private static final String TURN_ID_PREFIX = "turn-";
    private static final String FALLBACK_UTTERANCE = "我们先停一下：用一句话说说你现在对「%s」的理解？";
    private static final String DEFAULT_OBJECTIVE = "这个概念";

    private final ITimelineRepository timelineRepository;
    private final ISessionStateRepository sessionStateRepository;
    private final SessionReducerDomainService sessionReducerDomainService;
    private final DirectorDecisionSupport directorDecisionSupport;
    private final ActorPromptDomainService actorPromptDomainService;
    private final IUtteranceGenerator utteranceGenerator;
    private final Striped<Lock> sessionLocks;
    private final Clock clock;

    public SessionEventCommandService(ITimelineRepository timelineRepository,
                                      ISessionStateRepository sessionStateRepository,
                                      SessionReducerDomainService sessionReducerDomainService,
                                      DirectorDecisionSupport directorDecisionSupport,
                                      ActorPromptDomainService actorPromptDomainService,
                                      IUtteranceGenerator utteranceGenerator,
                                      @Qualifier("sessionLocks") Striped<Lock> sessionLocks,
                                      Clock clock) {
        this.timelineRepository = timelineRepository;
        this.sessionStateRepository = sessionStateRepository;
        this.sessionReducerDomainService = sessionReducerDomainService;
        this.directorDecisionSupport = directorDecisionSupport;
        this.actorPromptDomainService = actorPromptDomainService;
        this.utteranceGenerator = utteranceGenerator;
        this.sessionLocks = sessionLocks;
        this.clock = clock;
    }

    public SessionEventResult onEvent(String sessionId, TimelineEventEntity inbound) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId 不能为空");
        }
        if (inbound == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "事件不能为空");
        }
        Lock lock = sessionLocks.get(sessionId);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.UN_ERROR, "会话事件处理被中断", ex);
        }
        try {
            return process(sessionId, inbound);
        } finally {
            lock.unlock();
        }
    }

    private SessionEventResult process(String sessionId, TimelineEventEntity inbound) {
        SessionStateEntity state = sessionStateRepository.findById(sessionId);
        if (state == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND, "会话不存在: " + sessionId);
        }
        TimelineEventEntity event = normalize(sessionId, inbound, now());

        if (event.hasEventId()) {
            Long existingSeq = timelineRepository.findSeqByEventId(sessionId, event.getEventId());
            if (existingSeq != null) {
                return resumeDuplicate(state, event.getEventId(), existingSeq);
            }
        }

        long userSeq = appendAndReduce(state, event);
        log.info("SESSION_EVENT_ACCEPTED sessionId={}, seq={}, eventId={}, turnId={}, type={}",
                sessionId,
                userSeq,
                event.getEventId(),
                event.getTurnId(),
                event.getType());
        return runTurn(state, event, null, null, false);
    }

    /**
     * 重复事件：先以时间线重放追平快照（上次可能在追加后、保存前中断），
     * 计划与回复都已落盘时直接返回，缺哪一步就从哪一步续跑。
     */
    private SessionEventResult resumeDuplicate(SessionStateEntity stored, String eventId, long userSeq) {
        List<TimelineEventEntity> events = timelineRepository.list(stored.getSessionId());
        SessionStateEntity state = catchUp(stored, events);
        TimelineEventEntity userEvent = null;
        TimelineEventEntity planEvent = null;
        TimelineEventEntity replyEvent = null;
        for (TimelineEventEntity candidate : events) {
            if (candidate.getSeq() != null && candidate.getSeq() == userSeq) {
                userEvent = candidate;
            } else if ((eventId + PLAN_EVENT_SUFFIX).equals(candidate.getEventId())) {
                planEvent = candidate;
            } else if ((eventId + REPLY_EVENT_SUFFIX).equals(candidate.getEventId())) {
                replyEvent = candidate;
            }
        }
        if (userEvent == null) {
            // 事件 ID 索引仍在而事件已不可见，只可能是存储损坏
            throw new AppException(ResponseCode.STORE_FAILURE, "时间线缺少已登记的事件: seq=" + userSeq);
        }
        log.info("SESSION_EVENT_DUPLICATE sessionId={}, seq={}, eventId={}, planPresent={}, replyPresent={}",
                state.getSessionId(),
                userSeq,
                eventId,
                planEvent != null,
                replyEvent != null);

        if (planEvent != null && replyEvent != null) {
            SessionEventResult result = new SessionEventResult();
            result.setSessionId(state.getSessionId());
            result.setTurnId(userEvent.getTurnId());
            result.setUserSeq(userSeq);
            result.setPlanSeq(planEvent.getSeq());
            result.setReplySeq(replyEvent.getSeq());
            result.setPlan(planEvent.getDirectorPlan());
            result.setNeedUserAction(resolveUserAction(planEvent.getDirectorPlan()));
            result.setAssistantText(replyEvent.getText());
            result.setDuplicate(true);
            return result;
        }
        return runTurn(state,
                userEvent,
                planEvent == null ? null : planEvent.getDirectorPlan(),
                planEvent == null ? null : planEvent.getSeq(),
                true);
    }

    private SessionEventResult runTurn(SessionStateEntity state,
                                       TimelineEventEntity userEvent,
                                       DirectorPlan storedPlan,
                                       Long storedPlanSeq,
                                       boolean duplicate) {
        String sessionId = state.getSessionId();
        String turnId = userEvent.getTurnId();
        String userText = userEvent.userText();

        DirectorPlan plan = storedPlan;
        Long planSeq = storedPlanSeq;
        if (plan == null) {
            plan = directorDecisionSupport.decide(state, userEvent);
            TimelineEventEntity planEvent = derivedEvent(sessionId, userEvent, EventTypeEnum.DIRECTOR_PLAN, PLAN_EVENT_SUFFIX);
            planEvent.setDirectorPlan(plan.copy());
            planSeq = appendAndReduce(state, planEvent);
        }

        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan, ActorSessionContext.from(state, turnId, userText));
        boolean utteranceFallback = false;
        String assistantText = generateUtterance(state, plan, prompt, userText);
        if (assistantText == null) {
            utteranceFallback = true;
            assistantText = fallbackUtterance(state);
        }

        TimelineEventEntity replyEvent = derivedEvent(sessionId, userEvent, EventTypeEnum.ASSISTANT_TEXT, REPLY_EVENT_SUFFIX);
        replyEvent.setText(assistantText);
        long replySeq = appendAndReduce(state, replyEvent);

        log.info("SESSION_TURN_COMPLETED sessionId={}, turnId={}, userSeq={}, planSeq={}, replySeq={}, beat={}, role={}, action={}, source={}",
                sessionId,
                turnId,
                userEvent.getSeq(),
                planSeq,
                replySeq,
                plan.getNextBeat(),
                plan.getNextRole(),
                plan.getOutputAction() == null ? null : plan.getOutputAction().getCode(),
                plan.getDebug() == null ? null : plan.getDebug().getSource());

        SessionEventResult result = new SessionEventResult();
        result.setSessionId(sessionId);
        result.setTurnId(turnId);
        result.setUserSeq(userEvent.getSeq());
        result.setPlanSeq(planSeq);
        result.setReplySeq(replySeq);
        result.setPlan(plan);
        result.setNeedUserAction(resolveUserAction(plan));
        result.setAssistantText(assistantText);
        result.setInstructions(prompt.getInstructions());
        result.setPromptFallback(prompt.isFallback());
        result.setUtteranceFallback(utteranceFallback);
        result.setDuplicate(duplicate);
        return result;
    }

    /**
     * 生成失败或输出为空时返回 null，由调用方换成兜底回复。
     */
    private String generateUtterance(SessionStateEntity state, DirectorPlan plan, ActorPrompt prompt, String userText) {
        String reason;
        try {
            String text = utteranceGenerator.generate(new UtteranceRequest(
                    state.getSessionId(),
                    plan.getNextRole(),
                    prompt.getInstructions(),
                    userText));
            if (StringUtils.isNotBlank(text)) {
                return text.trim();
            }
            reason = "blank_output";
        } catch (AppException ex) {
            reason = ex.getCode() + ":" + ex.getInfo();
        } catch (RuntimeException ex) {
            reason = ex.getClass().getSimpleName() + ":" + ex.getMessage();
        }
        log.warn("UTTERANCE_FALLBACK sessionId={}, role={}, reason={}", state.getSessionId(), plan.getNextRole(), reason);
        return null;
    }

    private String fallbackUtterance(SessionStateEntity state) {
        return String.format(FALLBACK_UTTERANCE, StringUtils.defaultIfBlank(state.getMainObjective(), DEFAULT_OBJECTIVE));
    }

    private UserMustDo resolveUserAction(DirectorPlan plan) {
        if (plan == null || !plan.requiresUserOutput() || plan.getUserMustDo() == null) {
            return null;
        }
        return plan.getUserMustDo().copy();
    }

    private SessionStateEntity catchUp(SessionStateEntity stored, List<TimelineEventEntity> events) {
        SessionStateEntity rebuilt = sessionReducerDomainService.replay(stored.seed(), events);
        if (rebuilt.equals(stored)) {
            return stored;
        }
        log.warn("SESSION_STATE_CAUGHT_UP sessionId={}, eventCount={}, storedTurns={}, rebuiltTurns={}",
                stored.getSessionId(),
                events.size(),
                stored.getTurns().size(),
                rebuilt.getTurns().size());
        try {
            sessionStateRepository.save(rebuilt);
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("SESSION_STATE_STORE_FAILED sessionId={}", stored.getSessionId(), ex);
            throw new AppException(ResponseCode.STORE_FAILURE, "快照保存失败: " + ex.getMessage(), ex);
        }
        return rebuilt;
    }

    /**
     * 追加事件并立即归约、保存快照。
     */
    private long appendAndReduce(SessionStateEntity state, TimelineEventEntity event) {
        try {
            long seq = timelineRepository.append(state.getSessionId(), event);
            event.setSeq(seq);
            sessionReducerDomainService.reduce(state, event, event.getServerTimestamp());
            sessionStateRepository.save(state);
            return seq;
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("SESSION_EVENT_STORE_FAILED sessionId={}, type={}, eventId={}",
                    state.getSessionId(),
                    event.getType(),
                    event.getEventId(),
                    ex);
            throw new AppException(ResponseCode.STORE_FAILURE, "事件落盘失败: " + ex.getMessage(), ex);
        }
    }

    private TimelineEventEntity normalize(String sessionId, TimelineEventEntity inbound, LocalDateTime now) {
        TimelineEventEntity event = inbound.copy();
        event.setSeq(null);
        event.setSessionId(sessionId);
        event.setType(StringUtils.defaultIfBlank(StringUtils.trimToNull(event.getType()), EventTypeEnum.USER_MESSAGE.getCode()));
        event.setEventId(StringUtils.trimToNull(event.getEventId()));
        if (event.getClientTimestamp() == null) {
            event.setClientTimestamp(now);
        }
        event.setServerTimestamp(now);
        // 入站事件不允许夹带导演计划
        event.setDirectorPlan(null);
        String turnId = StringUtils.trimToNull(event.getTurnId());
        if (turnId == null) {
            turnId = event.getEventId() != null ? event.getEventId() : TURN_ID_PREFIX + UUID.randomUUID();
        }
        event.setTurnId(turnId);
        return event;
    }

    private TimelineEventEntity derivedEvent(String sessionId, TimelineEventEntity userEvent, EventTypeEnum type, String suffix) {
        LocalDateTime now = now();
        TimelineEventEntity event = TimelineEventEntity.of(type, null);
        event.setSessionId(sessionId);
        event.setTurnId(userEvent.getTurnId());
        event.setEventId(userEvent.hasEventId() ? userEvent.getEventId() + suffix : null);
        event.setClientTimestamp(now);
        event.setServerTimestamp(now);
        return event;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 一轮编排的结果。
     */
    @Data
    public static class SessionEventResult {
        private String sessionId;
        private String turnId;
        private Long userSeq;
        private Long planSeq;
        private Long replySeq;
        private String assistantText;
        private UserMustDo needUserAction;
        private DirectorPlan plan;
        private String instructions;
        private boolean promptFallback;
        private boolean utteranceFallback;
        private boolean duplicate;
    }
}

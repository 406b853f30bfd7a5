package com.voicetutor.trigger.application.query;

import com.voicetutor.domain.actor.model.valobj.ActorPrompt;
import com.voicetutor.domain.actor.model.valobj.ActorSessionContext;
import com.voicetutor.domain.actor.service.ActorPromptDomainService;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.session.adapter.repository.ILearningEntryRepository;
import com.voicetutor.domain.session.adapter.repository.ISessionStateRepository;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.service.SessionReducerDomainService;
import com.voicetutor.domain.timeline.adapter.repository.ITimelineRepository;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.trigger.application.common.DirectorDecisionSupport;
import com.voicetutor.types.enums.EventTypeEnum;
import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话读用例：快照、时间线、重放校验、开场指令与学习入口列表。都不向时间线追加事件。
 */
@Slf4j
@Service
public class SessionQueryService {

    private final ISessionStateRepository sessionStateRepository;
    private final ITimelineRepository timelineRepository;
    private final ILearningEntryRepository learningEntryRepository;
    private final SessionReducerDomainService sessionReducerDomainService;
    private final DirectorDecisionSupport directorDecisionSupport;
    private final ActorPromptDomainService actorPromptDomainService;
    private final Clock clock;

    public SessionQueryService(ISessionStateRepository sessionStateRepository,
                               ITimelineRepository timelineRepository,
                               ILearningEntryRepository learningEntryRepository,
                               SessionReducerDomainService sessionReducerDomainService,
                               DirectorDecisionSupport directorDecisionSupport,
                               ActorPromptDomainService actorPromptDomainService,
                               Clock clock) {
        this.sessionStateRepository = sessionStateRepository;
        this.timelineRepository = timelineRepository;
        this.learningEntryRepository = learningEntryRepository;
        this.sessionReducerDomainService = sessionReducerDomainService;
        this.directorDecisionSupport = directorDecisionSupport;
        this.actorPromptDomainService = actorPromptDomainService;
        this.clock = clock;
    }

    public SessionStateEntity getSnapshot(String sessionId) {
        return requireSession(sessionId);
    }

    public List<TimelineEventEntity> listTimeline(String sessionId) {
        requireSession(sessionId);
        return timelineRepository.list(sessionId);
    }

    /**
     * 以会话种子为起点重放整条时间线，并与当前快照比对。
     */
    public SessionReplayResult replay(String sessionId) {
        SessionStateEntity current = requireSession(sessionId);
        List<TimelineEventEntity> events = timelineRepository.list(sessionId);
        SessionStateEntity rebuilt = sessionReducerDomainService.replay(current.seed(), events);
        boolean consistent = rebuilt.equals(current);
        if (!consistent) {
            log.warn("SESSION_REPLAY_DIVERGED sessionId={}, eventCount={}, storedTurns={}, rebuiltTurns={}",
                    sessionId,
                    events.size(),
                    current.getTurns().size(),
                    rebuilt.getTurns().size());
        }
        return new SessionReplayResult(sessionId, rebuilt, events.size(), consistent);
    }

    /**
     * 开场指令：以空的用户消息跑一遍导演与指令组装，供语音通道建连时使用。
     */
    public InitialInstructionsResult initialInstructions(String sessionId) {
        SessionStateEntity state = requireSession(sessionId);
        LocalDateTime now = LocalDateTime.now(clock);
        TimelineEventEntity probe = TimelineEventEntity.of(EventTypeEnum.USER_MESSAGE, "");
        probe.setSessionId(sessionId);
        probe.setClientTimestamp(now);
        probe.setServerTimestamp(now);

        DirectorPlan plan = directorDecisionSupport.decide(state, probe);
        ActorPrompt prompt = actorPromptDomainService.buildPrompt(plan, ActorSessionContext.from(state, null, ""));
        return new InitialInstructionsResult(sessionId, prompt.getInstructions(), prompt.isFallback(), plan);
    }

    public List<LearningEntry> listEntries() {
        return learningEntryRepository.findAll();
    }

    private SessionStateEntity requireSession(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "sessionId 不能为空");
        }
        SessionStateEntity state = sessionStateRepository.findById(sessionId);
        if (state == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND, "会话不存在: " + sessionId);
        }
        return state;
    }

    public record SessionReplayResult(String sessionId, SessionStateEntity rebuilt, int eventCount, boolean consistent) {
    }

    public record InitialInstructionsResult(String sessionId, String instructions, boolean fallback, DirectorPlan plan) {
    }
}

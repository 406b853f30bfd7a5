package com.voicetutor.trigger.application.command;

import com.voicetutor.domain.session.adapter.repository.ILearningEntryRepository;
import com.voicetutor.domain.session.adapter.repository.ISessionStateRepository;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.model.valobj.QuizQuestion;
import com.voicetutor.domain.session.service.SessionLifecycleDomainService;
import com.voicetutor.domain.session.service.SessionReducerDomainService;
import com.voicetutor.domain.timeline.adapter.repository.ITimelineRepository;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
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
 * 会话开启写用例。
 */
@Slf4j
@Service
public class SessionCommandService {

    private static final String START_EVENT_SUFFIX = "#start";

    private final ILearningEntryRepository learningEntryRepository;
    private final ISessionStateRepository sessionStateRepository;
    private final ITimelineRepository timelineRepository;
    private final SessionLifecycleDomainService sessionLifecycleDomainService;
    private final SessionReducerDomainService sessionReducerDomainService;
    private final Clock clock;

    public SessionCommandService(ILearningEntryRepository learningEntryRepository,
                                 ISessionStateRepository sessionStateRepository,
                                 ITimelineRepository timelineRepository,
                                 SessionLifecycleDomainService sessionLifecycleDomainService,
                                 SessionReducerDomainService sessionReducerDomainService,
                                 Clock clock) {
        this.learningEntryRepository = learningEntryRepository;
        this.sessionStateRepository = sessionStateRepository;
        this.timelineRepository = timelineRepository;
        this.sessionLifecycleDomainService = sessionLifecycleDomainService;
        this.sessionReducerDomainService = sessionReducerDomainService;
        this.clock = clock;
    }

    public SessionOpenResult openSession(String entryId) {
        if (StringUtils.isBlank(entryId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "entryId 不能为空");
        }
        LearningEntry entry = learningEntryRepository.findById(entryId.trim());
        if (entry == null) {
            throw new AppException(ResponseCode.ENTRY_NOT_FOUND, "学习入口不存在: " + entryId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        SessionStateEntity state = sessionLifecycleDomainService.openSession(entry, now);
        sessionStateRepository.save(state);

        TimelineEventEntity started = TimelineEventEntity.of(EventTypeEnum.SESSION_STARTED, null);
        started.setSessionId(state.getSessionId());
        started.setEventId(state.getSessionId() + START_EVENT_SUFFIX);
        started.setClientTimestamp(now);
        started.setServerTimestamp(now);
        long seq = timelineRepository.append(state.getSessionId(), started);
        started.setSeq(seq);
        sessionReducerDomainService.reduce(state, started, now);
        sessionStateRepository.save(state);

        log.info("SESSION_OPENED sessionId={}, entryId={}, domain={}, roles={}, seq={}",
                state.getSessionId(),
                entry.getEntryId(),
                entry.getDomain(),
                state.getAvailableRoles(),
                seq);
        return new SessionOpenResult(state, sessionLifecycleDomainService.diagnoseQuestions(entry));
    }

    public record SessionOpenResult(SessionStateEntity state, List<QuizQuestion> diagnose) {
    }
}

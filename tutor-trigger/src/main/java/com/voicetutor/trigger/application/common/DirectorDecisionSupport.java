package com.voicetutor.trigger.application.common;

import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.service.DirectorPolicyDomainService;
import com.voicetutor.domain.director.service.DirectorService;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 导演调用封装：导演只拿到快照与事件的拷贝，任何异常或空计划都替换为兜底计划。
 */
@Slf4j
@Component
public class DirectorDecisionSupport {

    private static final String REASON_INTERNAL_ERROR = "internal_error";
    private static final String REASON_EMPTY_PLAN = "empty_plan";

    private final DirectorService directorService;
    private final DirectorPolicyDomainService directorPolicyDomainService;
    private final DirectorSettings directorSettings;

    public DirectorDecisionSupport(DirectorService directorService,
                                   DirectorPolicyDomainService directorPolicyDomainService,
                                   DirectorSettings directorSettings) {
        this.directorService = directorService;
        this.directorPolicyDomainService = directorPolicyDomainService;
        this.directorSettings = directorSettings;
    }

    public DirectorPlan decide(SessionStateEntity state, TimelineEventEntity event) {
        DirectorPlan plan;
        try {
            plan = directorService.decide(state.copy(), event == null ? null : event.copy(), directorSettings);
        } catch (RuntimeException ex) {
            log.warn("DIRECTOR_DECIDE_FAILED sessionId={}, errorType={}, error={}",
                    state.getSessionId(),
                    ex.getClass().getSimpleName(),
                    ex.getMessage());
            return directorPolicyDomainService.fallbackPlan(state, directorSettings, REASON_INTERNAL_ERROR);
        }
        if (plan == null) {
            log.warn("DIRECTOR_DECIDE_FAILED sessionId={}, error=plan is null", state.getSessionId());
            return directorPolicyDomainService.fallbackPlan(state, directorSettings, REASON_EMPTY_PLAN);
        }
        return plan;
    }
}

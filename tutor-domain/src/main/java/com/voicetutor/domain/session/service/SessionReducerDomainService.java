package com.voicetutor.domain.session.service;

import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.BranchQuestion;
import com.voicetutor.domain.session.model.valobj.SignalSnapshot;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.types.enums.EventTypeEnum;
import com.voicetutor.types.enums.MessageRoleEnum;
import com.voicetutor.types.enums.StackActionEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话归约领域服务：(快照, 事件, now) -> 快照。
 * <p>
 * 除修改入参快照外没有副作用，相同输入得到相同结果，可以对完整时间线重放重建快照。
 * </p>
 */
@Service
public class SessionReducerDomainService {

    public SessionStateEntity reduce(SessionStateEntity state, TimelineEventEntity event, LocalDateTime now) {
        if (state == null) {
            throw new IllegalStateException("Session state cannot be null");
        }
        if (event == null) {
            return state;
        }
        EventTypeEnum type = event.resolveType();
        if (type == null) {
            applyUserText(state, event, now);
        } else {
            switch (type) {
                case ASSISTANT_TEXT -> applyAssistantText(state, event, now);
                case QUIZ_ANSWER -> applyQuizAnswer(state, event, now);
                case DIRECTOR_PLAN -> applyDirectorPlan(state, event, now);
                case SESSION_STARTED -> state.resetOutputClock(now);
                case BARGE_IN, WORLD_ENTERED -> {
                    // 仅记录事实
                }
                default -> applyUserText(state, event, now);
            }
        }
        state.setUpdatedAt(now);
        return state;
    }

    /**
     * 从种子快照按序折叠事件，每个事件使用其服务端时间作为 now。
     */
    public SessionStateEntity replay(SessionStateEntity seed, List<TimelineEventEntity> events) {
        SessionStateEntity state = seed.copy();
        if (events == null) {
            return state;
        }
        for (TimelineEventEntity event : events) {
            reduce(state, event, event.getServerTimestamp());
        }
        return state;
    }

    private void applyAssistantText(SessionStateEntity state, TimelineEventEntity event, LocalDateTime now) {
        if (StringUtils.isEmpty(event.getText())) {
            return;
        }
        state.appendTurn(MessageRoleEnum.ASSISTANT, event.getText(), now);
        state.resetOutputClock(now);
    }

    // 答题不是对话轮次边界，不动输出时钟
    private void applyQuizAnswer(SessionStateEntity state, TimelineEventEntity event, LocalDateTime now) {
        if (StringUtils.isEmpty(event.getAnswer())) {
            return;
        }
        state.appendTurn(MessageRoleEnum.USER, event.getAnswer(), now);
    }

    private void applyUserText(SessionStateEntity state, TimelineEventEntity event, LocalDateTime now) {
        String text = event.getText();
        if (StringUtils.isEmpty(text)) {
            return;
        }
        state.recomputeOutputClock(now);
        SignalSnapshot signals = state.getSignals() == null ? new SignalSnapshot() : state.getSignals();
        signals.setLastUserChars(text.length());
        signals.setLastUserLatencyMs(resolveLatencyMs(state.getLastOutputAt(), event.getClientTimestamp(), now));
        state.setSignals(signals);
        state.setLastUserUtterance(text);
        state.appendTurn(MessageRoleEnum.USER, text, now);
    }

    private void applyDirectorPlan(SessionStateEntity state, TimelineEventEntity event, LocalDateTime now) {
        DirectorPlan plan = event.getDirectorPlan();
        if (plan == null) {
            return;
        }
        if (StringUtils.isNotBlank(plan.getNextBeat())) {
            state.setBeat(plan.getNextBeat());
        }
        StackActionEnum stackAction = plan.getStackAction();
        if (stackAction == StackActionEnum.PUSH && StringUtils.isNotBlank(state.getLastUserUtterance())) {
            String questionId = "BQ_" + (event.getSeq() == null ? state.getQuestionStack().size() + 1 : event.getSeq());
            state.pushBranchQuestion(new BranchQuestion(questionId, state.getLastUserUtterance(), now));
        } else if (stackAction == StackActionEnum.POP) {
            state.popBranchQuestion();
        }
    }

    private long resolveLatencyMs(LocalDateTime lastOutputAt, LocalDateTime clientTimestamp, LocalDateTime now) {
        if (lastOutputAt == null) {
            return 0L;
        }
        LocalDateTime spokeAt = clientTimestamp == null ? now : clientTimestamp;
        if (spokeAt == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(lastOutputAt, spokeAt).toMillis());
    }
}

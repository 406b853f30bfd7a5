package com.voicetutor.domain.session.service;

import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.model.valobj.QuizQuestion;
import com.voicetutor.types.common.Constants;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 会话生命周期领域服务：按学习入口开启新会话，给出开场诊断题。
 */
@Service
public class SessionLifecycleDomainService {

    public static final String OPENING_BEAT = "ColdOpen";
    public static final String DEFAULT_PACING_MODE = "NORMAL";
    public static final double INITIAL_MASTERY = 0.2D;
    public static final int INITIAL_TENSION = 2;
    public static final int INITIAL_LOAD = 2;

    private static final AtomicLong LAST_SESSION_NANOS = new AtomicLong();

    public SessionStateEntity openSession(LearningEntry entry, LocalDateTime now) {
        if (entry == null) {
            throw new IllegalStateException("Learning entry cannot be null");
        }
        SessionStateEntity state = new SessionStateEntity();
        state.setSessionId(nextSessionId());
        state.setEntryId(entry.getEntryId());
        state.setDomain(entry.getDomain());
        state.setAvailableRoles(entry.getRoles() == null ? new ArrayList<>() : new ArrayList<>(entry.getRoles()));
        state.setMainObjective(entry.getTitle());
        state.setMetaphor(entry.getMetaphor());
        state.setAct(1);
        state.setBeat(OPENING_BEAT);
        state.setPacingMode(DEFAULT_PACING_MODE);
        state.setMasteryEstimate(INITIAL_MASTERY);
        state.setTensionLevel(INITIAL_TENSION);
        state.setCognitiveLoad(INITIAL_LOAD);
        state.setLastOutputAt(now);
        state.setCreatedAt(now);
        state.setUpdatedAt(now);
        return state;
    }

    /**
     * 入口未配置诊断题时使用默认的“机会成本”诊断。
     */
    public List<QuizQuestion> diagnoseQuestions(LearningEntry entry) {
        if (entry != null && entry.getDiagnoseQuestions() != null && !entry.getDiagnoseQuestions().isEmpty()) {
            return new ArrayList<>(entry.getDiagnoseQuestions());
        }
        List<QuizQuestion> questions = new ArrayList<>();
        questions.add(new QuizQuestion("diag_q1", "机会成本更接近以下哪个含义？",
                Arrays.asList("花出去的钱", "放弃的最好替代价值", "工资收入")));
        questions.add(new QuizQuestion("diag_q2", "周末加班的机会成本最可能是？",
                Arrays.asList("多赚的钱", "失去的休息或副业机会", "加班餐补")));
        return questions;
    }

    private String nextSessionId() {
        long nanos = LAST_SESSION_NANOS.updateAndGet(last -> Math.max(last + 1, System.nanoTime()));
        return Constants.SESSION_ID_PREFIX + nanos;
    }
}

package com.voicetutor.domain.session.model.entity;

import com.voicetutor.domain.session.model.valobj.BranchQuestion;
import com.voicetutor.domain.session.model.valobj.ConversationTurn;
import com.voicetutor.domain.session.model.valobj.SignalSnapshot;
import com.voicetutor.types.enums.MessageRoleEnum;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 会话快照实体。
 * <p>
 * 快照只由归约产生：任意时刻都可以由 {@link #seed()} 与完整时间线重放得到同一个快照。
 * {@code turns} 只增不减，{@code outputClockSec} 始终非负，在每个用户事件上重新计算而不是累加。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Data
public class SessionStateEntity {

    // 身份
    private String sessionId;
    private String entryId;
    private String domain;
    private List<String> availableRoles = new ArrayList<>();

    // 教学目标
    private String mainObjective;
    private String metaphor;
    private int act;
    private String beat;
    private String pacingMode;

    // 学习者模型
    private double masteryEstimate;
    private Set<String> misconceptionTags = new LinkedHashSet<>();

    // 节奏信号
    private long outputClockSec;
    private LocalDateTime lastOutputAt;
    private int tensionLevel;
    private int cognitiveLoad;

    private List<BranchQuestion> questionStack = new ArrayList<>();
    private SignalSnapshot signals = new SignalSnapshot();
    private List<ConversationTurn> turns = new ArrayList<>();
    private String lastUserUtterance;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void appendTurn(MessageRoleEnum role, String text, LocalDateTime timestamp) {
        turns.add(new ConversationTurn(role, text, timestamp));
    }

    /**
     * 助手输出后输出时钟归零。
     */
    public void resetOutputClock(LocalDateTime now) {
        this.outputClockSec = 0L;
        this.lastOutputAt = now;
    }

    /**
     * 按“距上次输出经过的秒数”重新计算输出时钟，没有上次输出时保持不变。
     */
    public void recomputeOutputClock(LocalDateTime now) {
        if (lastOutputAt == null || now == null) {
            return;
        }
        long elapsed = Duration.between(lastOutputAt, now).getSeconds();
        this.outputClockSec = Math.max(0L, elapsed);
    }

    public boolean hasMisconceptions() {
        return misconceptionTags != null && !misconceptionTags.isEmpty();
    }

    public int assistantTurnCount() {
        int count = 0;
        for (ConversationTurn turn : turns) {
            if (turn.isAssistant()) {
                count++;
            }
        }
        return count;
    }

    /**
     * 最近 n 个轮次，按时间顺序。
     */
    public List<ConversationTurn> recentTurns(int n) {
        if (turns.isEmpty() || n <= 0) {
            return Collections.emptyList();
        }
        int from = Math.max(0, turns.size() - n);
        return new ArrayList<>(turns.subList(from, turns.size()));
    }

    public void pushBranchQuestion(BranchQuestion question) {
        questionStack.add(question);
    }

    /**
     * 先进先出，队首出栈；空栈返回 null。
     */
    public BranchQuestion popBranchQuestion() {
        if (questionStack.isEmpty()) {
            return null;
        }
        return questionStack.remove(0);
    }

    public BranchQuestion peekBranchQuestion() {
        return questionStack.isEmpty() ? null : questionStack.get(0);
    }

    /**
     * 重放起点：保留身份、目标、当前节拍与学习者模型，清空轮次、时钟、信号与分支问题。
     */
    public SessionStateEntity seed() {
        SessionStateEntity seed = new SessionStateEntity();
        seed.setSessionId(sessionId);
        seed.setEntryId(entryId);
        seed.setDomain(domain);
        seed.setAvailableRoles(new ArrayList<>(availableRoles));
        seed.setMainObjective(mainObjective);
        seed.setMetaphor(metaphor);
        seed.setAct(act);
        seed.setBeat(beat);
        seed.setPacingMode(pacingMode);
        seed.setMasteryEstimate(masteryEstimate);
        seed.setMisconceptionTags(new LinkedHashSet<>(misconceptionTags));
        seed.setTensionLevel(tensionLevel);
        seed.setCognitiveLoad(cognitiveLoad);
        seed.setCreatedAt(createdAt);
        return seed;
    }

    /**
     * 深拷贝。仓储读写都使用拷贝，调用方拿到的快照是自己的工作副本。
     */
    public SessionStateEntity copy() {
        SessionStateEntity copy = seed();
        copy.setOutputClockSec(outputClockSec);
        copy.setLastOutputAt(lastOutputAt);
        List<BranchQuestion> stack = new ArrayList<>();
        for (BranchQuestion question : questionStack) {
            stack.add(new BranchQuestion(question.getQuestionId(), question.getPrompt(), question.getCreatedAt()));
        }
        copy.setQuestionStack(stack);
        copy.setSignals(signals == null ? new SignalSnapshot() : signals.copy());
        List<ConversationTurn> turnCopies = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            turnCopies.add(new ConversationTurn(turn.getRole(), turn.getText(), turn.getTimestamp()));
        }
        copy.setTurns(turnCopies);
        copy.setLastUserUtterance(lastUserUtterance);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}

package com.voicetutor.domain.director.service;

import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorDebug;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.director.model.valobj.UserMustDo;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import com.voicetutor.types.enums.StackActionEnum;
import com.voicetutor.types.enums.UserMustDoTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 导演规则领域服务：心智状态、意图、候选节拍、角色轮换、时长预算与护栏。
 * <p>
 * 规则实现与委托实现共用本服务，保证两者的计划都满足同一组约束。
 * </p>
 */
@Service
public class DirectorPolicyDomainService {

    public static final String FALLBACK_BEAT = BeatLibrary.CHECK;
    public static final String DEFAULT_ROLE = "host";
    public static final String SOURCE_HEURISTIC = "heuristic";
    public static final String SOURCE_DELEGATED = "delegated";
    public static final String SOURCE_FALLBACK = "fallback";

    private static final double LOW_MASTERY = 0.4D;
    private static final double HIGH_MASTERY = 0.7D;
    private static final int FOG_LOAD_THRESHOLD = 6;
    private static final int ILLUSION_TENSION_THRESHOLD = 4;
    private static final int FATIGUE_MAX_CHARS = 10;
    private static final long FATIGUE_MIN_LATENCY_MS = 5000L;

    private static final List<String> CONFUSION_KEYWORDS = List.of("不懂", "不明白", "什么意思", "confused", "don't understand");
    private static final List<String> EXAMPLE_KEYWORDS = List.of("例如", "比如", "举例", "案例", "example", "for instance");
    private static final List<String> META_KEYWORDS = List.of("慢一点", "太快", "再说一遍", "换个方式", "slow down", "repeat");
    private static final List<String> DEEPEN_KEYWORDS = List.of("为什么", "原理", "怎么会", "why", "how come");
    private static final List<String> BRANCH_KEYWORDS = List.of("那如果", "另外", "顺便", "what if", "by the way");
    private static final List<String> PACING_BEATS = List.of(BeatLibrary.CHECK, BeatLibrary.FEYNMAN, BeatLibrary.EXIT_TICKET);

    public FlowModeEnum inferFlowMode(SessionStateEntity state, String userText, DirectorSettings settings) {
        if (state.hasMisconceptions()
                || state.getMasteryEstimate() < LOW_MASTERY
                || state.getCognitiveLoad() > settings.getHighLevelThreshold()
                || state.getTensionLevel() > settings.getHighLevelThreshold()
                || containsAny(userText, CONFUSION_KEYWORDS)) {
            return FlowModeEnum.RESCUE;
        }
        return FlowModeEnum.FLOW;
    }

    public List<MindStateEnum> inferMindStates(SessionStateEntity state, String userText) {
        List<MindStateEnum> states = new ArrayList<>();
        int chars = state.getSignals() == null ? 0 : state.getSignals().getLastUserChars();
        long latency = state.getSignals() == null ? 0L : state.getSignals().getLastUserLatencyMs();
        if (chars < FATIGUE_MAX_CHARS && latency > FATIGUE_MIN_LATENCY_MS) {
            states.add(MindStateEnum.FATIGUE);
            return states;
        }
        double mastery = state.getMasteryEstimate();
        if (state.hasMisconceptions() && state.getCognitiveLoad() > FOG_LOAD_THRESHOLD) {
            states.add(MindStateEnum.FOG);
        }
        if (mastery < LOW_MASTERY && state.getTensionLevel() < ILLUSION_TENSION_THRESHOLD) {
            states.add(MindStateEnum.ILLUSION);
        }
        if (mastery >= LOW_MASTERY && mastery < HIGH_MASTERY) {
            states.add(MindStateEnum.PARTIAL);
        }
        if (mastery >= HIGH_MASTERY && !state.hasMisconceptions()) {
            states.add(MindStateEnum.AHA);
        }
        if (StringUtils.containsAny(StringUtils.defaultString(userText), "?", "？")) {
            states.add(MindStateEnum.VERIFY);
        }
        if (containsAny(userText, EXAMPLE_KEYWORDS)) {
            states.add(MindStateEnum.EXPAND);
        }
        if (states.isEmpty()) {
            states.add(MindStateEnum.ENGAGED);
        }
        return states;
    }

    public IntentEnum classifyIntent(String userText) {
        if (StringUtils.isBlank(userText)) {
            return IntentEnum.CONTINUE;
        }
        if (containsAny(userText, META_KEYWORDS)) {
            return IntentEnum.META;
        }
        if (containsAny(userText, CONFUSION_KEYWORDS)) {
            return IntentEnum.CLARIFY;
        }
        if (containsAny(userText, DEEPEN_KEYWORDS)) {
            return IntentEnum.DEEPEN;
        }
        if (containsAny(userText, BRANCH_KEYWORDS)) {
            return IntentEnum.BRANCH;
        }
        if (StringUtils.containsAny(userText, "?", "？")) {
            return IntentEnum.CLARIFY;
        }
        return IntentEnum.CONTINUE;
    }

    public StackActionEnum decideStackAction(SessionStateEntity state, IntentEnum intent) {
        if (intent == IntentEnum.BRANCH) {
            return StackActionEnum.PUSH;
        }
        if (intent == IntentEnum.CONTINUE && state.peekBranchQuestion() != null) {
            return StackActionEnum.POP;
        }
        return StackActionEnum.KEEP;
    }

    /**
     * 候选节拍，按优先级排列，已去重并过滤到可用节拍集合。
     */
    public List<String> beatCandidates(SessionStateEntity state,
                                       FlowModeEnum flowMode,
                                       List<MindStateEnum> mindStates,
                                       DirectorSettings settings) {
        Set<String> candidates = new LinkedHashSet<>();
        if (isOutputClockExceeded(state, settings)) {
            candidates.addAll(PACING_BEATS);
        } else if (mindStates.contains(MindStateEnum.FATIGUE)) {
            candidates.add(BeatLibrary.MINIGAME);
            candidates.add(BeatLibrary.EXIT_TICKET);
        } else if (flowMode == FlowModeEnum.FLOW) {
            candidates.add(BeatLibrary.CONTINUE);
            candidates.add(BeatLibrary.DEEPEN);
            candidates.add(BeatLibrary.CHECK);
        } else {
            for (MindStateEnum mindState : mindStates) {
                candidates.addAll(rescueBeats(mindState));
            }
        }
        if (candidates.isEmpty()) {
            candidates.add(BeatLibrary.CONTINUE);
            candidates.add(BeatLibrary.CHECK);
        }
        List<String> available = new ArrayList<>();
        for (String beat : candidates) {
            if (isBeatAvailable(beat, settings)) {
                available.add(beat);
            }
        }
        if (available.isEmpty()) {
            available.add(FALLBACK_BEAT);
        }
        return available;
    }

    /**
     * 按已有助手轮次轮换角色。
     */
    public String rotateRole(SessionStateEntity state, DirectorSettings settings) {
        List<String> roles = settings.resolveRoles(state);
        if (roles.isEmpty()) {
            return DEFAULT_ROLE;
        }
        return roles.get(state.assistantTurnCount() % roles.size());
    }

    public String defaultRole(SessionStateEntity state, DirectorSettings settings) {
        List<String> roles = settings.resolveRoles(state);
        return roles.isEmpty() ? DEFAULT_ROLE : roles.get(0);
    }

    public int talkBurstLimit(SessionStateEntity state, DirectorSettings settings) {
        if (isHighLoad(state, settings)) {
            return settings.getHighLoadTalkBurstLimitSec();
        }
        return settings.getDefaultTalkBurstLimitSec();
    }

    public GoalDirectionEnum goalFor(int level, DirectorSettings settings) {
        if (level < settings.getLowLevelThreshold()) {
            return GoalDirectionEnum.INCREASE;
        }
        if (level > settings.getHighLevelThreshold()) {
            return GoalDirectionEnum.DECREASE;
        }
        return GoalDirectionEnum.KEEP;
    }

    public UserMustDo userMustDoFor(OutputActionEnum outputAction) {
        if (outputAction == null || !outputAction.isOutputProducing()) {
            return null;
        }
        return new UserMustDo(outputAction.getUserMustDoType(), defaultPrompt(outputAction.getUserMustDoType()));
    }

    public boolean isOutputClockExceeded(SessionStateEntity state, DirectorSettings settings) {
        return state.getOutputClockSec() >= settings.getOutputClockThresholdSec();
    }

    /**
     * 计划护栏：节拍/角色落在可用集合内，动作与节拍一致，输出时钟超限时强制产出型动作，
     * 时长预算不超过当前负荷允许的上限，产出型动作补齐学习者任务。
     */
    public DirectorPlan applyGuardrails(DirectorPlan plan, SessionStateEntity state, DirectorSettings settings) {
        DirectorDebug debug = plan.getDebug() == null ? new DirectorDebug() : plan.getDebug();
        plan.setDebug(debug);

        if (!isBeatAvailable(plan.getNextBeat(), settings)) {
            debug.addGuardrailNote("beat " + plan.getNextBeat() + " unavailable, replaced by " + FALLBACK_BEAT);
            plan.setNextBeat(FALLBACK_BEAT);
            plan.setOutputAction(BeatLibrary.outputActionOf(FALLBACK_BEAT));
        }
        List<String> roles = settings.resolveRoles(state);
        if (StringUtils.isBlank(plan.getNextRole()) || (!roles.isEmpty() && !roles.contains(plan.getNextRole()))) {
            String role = defaultRole(state, settings);
            debug.addGuardrailNote("role " + plan.getNextRole() + " unavailable, replaced by " + role);
            plan.setNextRole(role);
        }
        if (plan.getOutputAction() == null) {
            plan.setOutputAction(BeatLibrary.outputActionOf(plan.getNextBeat()));
        }
        if (isOutputClockExceeded(state, settings) && !plan.requiresUserOutput()) {
            String forcedBeat = pacingBeat(settings);
            debug.addGuardrailNote("output clock " + state.getOutputClockSec() + "s >= "
                    + settings.getOutputClockThresholdSec() + "s, forced " + forcedBeat);
            plan.setNextBeat(forcedBeat);
            OutputActionEnum action = BeatLibrary.outputActionOf(forcedBeat);
            plan.setOutputAction(action.isOutputProducing() ? action : OutputActionEnum.ASK_SIMPLE_QUESTION);
            plan.setUserMustDo(null);
        }
        int budget = talkBurstLimit(state, settings);
        if (plan.getTalkBurstLimitSec() <= 0 || plan.getTalkBurstLimitSec() > budget) {
            plan.setTalkBurstLimitSec(budget);
        }
        if (plan.requiresUserOutput() && (plan.getUserMustDo() == null
                || plan.getUserMustDo().getType() == null
                || StringUtils.isBlank(plan.getUserMustDo().getPrompt()))) {
            plan.setUserMustDo(userMustDoFor(plan.getOutputAction()));
        }
        if (plan.getFlowMode() == null) {
            plan.setFlowMode(FlowModeEnum.RESCUE);
        }
        if (plan.getIntent() == null) {
            plan.setIntent(IntentEnum.CONTINUE);
        }
        if (plan.getTensionGoal() == null) {
            plan.setTensionGoal(goalFor(state.getTensionLevel(), settings));
        }
        if (plan.getLoadGoal() == null) {
            plan.setLoadGoal(goalFor(state.getCognitiveLoad(), settings));
        }
        if (plan.getStackAction() == null) {
            plan.setStackAction(StackActionEnum.KEEP);
        }
        if (plan.getUserMindState() == null) {
            plan.setUserMindState(new ArrayList<>());
        }
        return plan;
    }

    /**
     * 保守兜底计划：默认角色 + check 节拍 + recap 动作 + RESCUE。
     */
    public DirectorPlan fallbackPlan(SessionStateEntity state, DirectorSettings settings, String reason) {
        DirectorPlan plan = new DirectorPlan();
        plan.setFlowMode(FlowModeEnum.RESCUE);
        plan.setIntent(IntentEnum.CONTINUE);
        plan.setNextBeat(FALLBACK_BEAT);
        plan.setNextRole(defaultRole(state, settings));
        plan.setOutputAction(OutputActionEnum.RECAP);
        plan.setUserMustDo(userMustDoFor(OutputActionEnum.RECAP));
        plan.setTalkBurstLimitSec(talkBurstLimit(state, settings));
        plan.setTensionGoal(GoalDirectionEnum.KEEP);
        plan.setLoadGoal(GoalDirectionEnum.KEEP);
        plan.setStackAction(StackActionEnum.KEEP);
        plan.setNotes("fallback plan");
        DirectorDebug debug = new DirectorDebug();
        debug.setSource(SOURCE_FALLBACK);
        debug.setBeatCandidates(new ArrayList<>(List.of(FALLBACK_BEAT)));
        debug.setBeatChoiceReason("fallback");
        debug.setRoleChoiceReason("default role");
        debug.setFallbackReason(reason);
        plan.setDebug(debug);
        return plan;
    }

    public boolean isBeatAvailable(String beat, DirectorSettings settings) {
        if (StringUtils.isBlank(beat)) {
            return false;
        }
        List<String> beats = settings.getAvailableBeats();
        return beats == null || beats.isEmpty() || beats.contains(beat);
    }

    private String pacingBeat(DirectorSettings settings) {
        for (String beat : PACING_BEATS) {
            if (isBeatAvailable(beat, settings)) {
                return beat;
            }
        }
        if (settings.getAvailableBeats() != null) {
            for (String beat : settings.getAvailableBeats()) {
                if (BeatLibrary.outputActionOf(beat).isOutputProducing()) {
                    return beat;
                }
            }
        }
        return FALLBACK_BEAT;
    }

    private boolean isHighLoad(SessionStateEntity state, DirectorSettings settings) {
        return state.getCognitiveLoad() > settings.getHighLevelThreshold()
                || state.getTensionLevel() > settings.getHighLevelThreshold();
    }

    private List<String> rescueBeats(MindStateEnum mindState) {
        return switch (mindState) {
            case FOG -> List.of(BeatLibrary.REVEAL, BeatLibrary.LENS_SHIFT);
            case ILLUSION -> List.of(BeatLibrary.TWIST, BeatLibrary.CHECK);
            case PARTIAL -> List.of(BeatLibrary.LENS_SHIFT, BeatLibrary.DEEPEN);
            case AHA -> List.of(BeatLibrary.FEYNMAN, BeatLibrary.CHECK);
            case VERIFY -> List.of(BeatLibrary.DEEPEN, BeatLibrary.CHECK);
            case EXPAND -> List.of(BeatLibrary.MONTAGE, BeatLibrary.DEEPEN);
            default -> List.of();
        };
    }

    private String defaultPrompt(UserMustDoTypeEnum type) {
        return switch (type) {
            case TEACH_BACK -> "用一句话复述，必须包含因为…所以…";
            case CHOICE -> "从给出的选项里选一个，并说出理由";
            case EXAMPLE -> "举一个你身边的例子";
            case BOUNDARY -> "说出一个这个结论不成立的情况";
            case TRANSFER -> "把这个概念用到一个新的场景里";
        };
    }

    private boolean containsAny(String text, List<String> keywords) {
        if (StringUtils.isBlank(text)) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

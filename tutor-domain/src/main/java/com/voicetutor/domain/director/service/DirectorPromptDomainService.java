package com.voicetutor.domain.director.service;

import com.voicetutor.domain.director.model.valobj.BeatCard;
import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.ConversationTurn;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.MindStateEnum;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

import static org.apache.commons.lang3.StringUtils.defaultIfBlank;
import static org.apache.commons.lang3.StringUtils.defaultString;

/**
 * 导演提示词领域服务：为委托导演构建系统提示词与状态面板。
 */
@Service
public class DirectorPromptDomainService {

    private static final int RECENT_TURN_LIMIT = 4;

    public String buildSystemPrompt(DirectorSettings settings) {
        StringBuilder builder = new StringBuilder();
        builder.append("你是一档多角色语音教学节目的导演。每一轮你根据学习者状态决定下一位发言角色、节拍与输出动作。\n");
        builder.append("硬约束：\n");
        builder.append("- next_beat 只能从可用节拍中选择，next_role 只能从可用角色中选择；\n");
        builder.append("- Output Clock ≥ ").append(settings.getOutputClockThresholdSec())
                .append(" 秒时必须选择让学习者开口的节拍（check/feynman/exit_ticket）；\n");
        builder.append("- talk_burst_limit_sec 不超过 ").append(settings.getDefaultTalkBurstLimitSec())
                .append(" 秒，认知负荷或张力偏高时不超过 ").append(settings.getHighLoadTalkBurstLimitSec()).append(" 秒。\n");
        builder.append("取值范围：\n");
        builder.append("- flow_mode: FLOW | RESCUE\n");
        builder.append("- user_mind_state: Fog | Illusion | Partial | Aha | Verify | Expand | Fatigue | Engaged（可多选）\n");
        builder.append("- intent: Clarify | Deepen | Branch | Meta | OffTopic | Continue\n");
        builder.append("- output_action: explain_with_metaphor | ask_simple_question | ask_elaboration | challenge_assumption | ")
                .append("acknowledge_and_continue | reframe_perspective | ask_teach_back | show_multiple_examples | ")
                .append("engage_interactive | assess_transfer | recap | continue_dialogue\n");
        builder.append("- user_must_do.type: teach_back | choice | example | boundary | transfer\n");
        builder.append("- tension_goal / load_goal: increase | decrease | keep\n");
        builder.append("- stack_action: push | pop | keep\n");
        builder.append("仅输出一个 JSON 对象，字段：flow_mode, user_mind_state, intent, next_beat, next_role, output_action, ")
                .append("user_must_do{type,prompt}, talk_burst_limit_sec, tension_goal, load_goal, stack_action, notes。");
        return builder.toString();
    }

    public String buildUserPrompt(SessionStateEntity state,
                                  String userText,
                                  FlowModeEnum suggestedFlowMode,
                                  List<MindStateEnum> suggestedMindStates,
                                  List<String> beatCandidates,
                                  DirectorSettings settings) {
        StringBuilder builder = new StringBuilder();
        builder.append("## 当前状态面板\n");
        builder.append("学习目标：").append(defaultIfBlank(state.getMainObjective(), "未设定")).append('\n');
        builder.append("Mastery：").append(String.format("%.2f", state.getMasteryEstimate())).append('\n');
        builder.append("Misconceptions：").append(state.getMisconceptionTags()).append('\n');
        builder.append("Output Clock：").append(state.getOutputClockSec()).append(" 秒\n");
        builder.append("Tension：").append(state.getTensionLevel())
                .append("，Cognitive Load：").append(state.getCognitiveLoad()).append('\n');
        if (state.getSignals() != null) {
            builder.append("最近输出长度：").append(state.getSignals().getLastUserChars())
                    .append(" 字符，响应延迟：").append(state.getSignals().getLastUserLatencyMs()).append(" 毫秒\n");
        }
        if (state.peekBranchQuestion() != null) {
            builder.append("待回到的分支问题：").append(state.peekBranchQuestion().getPrompt()).append('\n');
        }
        builder.append("用户最新输入：\"").append(defaultString(userText)).append("\"\n");
        builder.append("\n## 最近对话\n").append(formatRecentTurns(state)).append('\n');
        builder.append("\n## 规则参考\n");
        builder.append("Flow Mode：").append(suggestedFlowMode).append('\n');
        builder.append("Mind State：").append(suggestedMindStates.stream().map(MindStateEnum::getCode)
                .collect(Collectors.joining(", "))).append('\n');
        builder.append("候选节拍：").append(String.join(", ", beatCandidates)).append('\n');
        builder.append("\n## 可用节拍\n").append(formatBeats(settings.getAvailableBeats())).append('\n');
        builder.append("\n## 可用角色\n").append(String.join(", ", settings.resolveRoles(state)));
        return builder.toString();
    }

    private String formatRecentTurns(SessionStateEntity state) {
        List<ConversationTurn> recent = state.recentTurns(RECENT_TURN_LIMIT);
        if (recent.isEmpty()) {
            return "(无历史对话)";
        }
        return recent.stream()
                .map(turn -> "[" + turn.getRole().getCode() + "]: " + defaultString(turn.getText()))
                .collect(Collectors.joining("\n"));
    }

    private String formatBeats(List<String> beats) {
        List<String> source = beats == null || beats.isEmpty() ? BeatLibrary.defaultBeats() : beats;
        StringBuilder builder = new StringBuilder();
        for (String beat : source) {
            BeatCard card = BeatLibrary.find(beat);
            builder.append("- ").append(beat);
            if (card != null) {
                builder.append(": ").append(card.goal())
                        .append("（用户需：").append(card.userMustDoHint())
                        .append("，时长：").append(card.talkBurstLimitHint()).append("s）");
            }
            builder.append('\n');
        }
        return builder.toString().trim();
    }
}

package com.voicetutor.domain.director.model.valobj;

import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.GoalDirectionEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import com.voicetutor.types.enums.StackActionEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 导演计划：下一轮的角色、节拍、输出动作与约束。
 * <p>
 * 计划本身不单独持久化，而是作为 director_plan 事件的载荷写入时间线。
 * </p>
 */
@Data
public class DirectorPlan {

    private List<MindStateEnum> userMindState = new ArrayList<>();
    private FlowModeEnum flowMode;
    private IntentEnum intent;
    private String nextBeat;
    private String nextRole;
    private OutputActionEnum outputAction;
    private UserMustDo userMustDo;
    private int talkBurstLimitSec;
    private GoalDirectionEnum tensionGoal;
    private GoalDirectionEnum loadGoal;
    private StackActionEnum stackAction;
    private String notes;
    private DirectorDebug debug;

    /**
     * 计划是否给出了可执行的指令。
     */
    public boolean isActionable() {
        return nextBeat != null && !nextBeat.isBlank() && outputAction != null;
    }

    public boolean requiresUserOutput() {
        return outputAction != null && outputAction.isOutputProducing();
    }

    public DirectorPlan copy() {
        DirectorPlan copy = new DirectorPlan();
        copy.setUserMindState(userMindState == null ? new ArrayList<>() : new ArrayList<>(userMindState));
        copy.setFlowMode(flowMode);
        copy.setIntent(intent);
        copy.setNextBeat(nextBeat);
        copy.setNextRole(nextRole);
        copy.setOutputAction(outputAction);
        copy.setUserMustDo(userMustDo == null ? null : userMustDo.copy());
        copy.setTalkBurstLimitSec(talkBurstLimitSec);
        copy.setTensionGoal(tensionGoal);
        copy.setLoadGoal(loadGoal);
        copy.setStackAction(stackAction);
        copy.setNotes(notes);
        copy.setDebug(debug == null ? null : debug.copy());
        return copy;
    }
}

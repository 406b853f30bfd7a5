package com.voicetutor.domain.director.service;

import com.voicetutor.domain.director.model.valobj.BeatLibrary;
import com.voicetutor.domain.director.model.valobj.DirectorDebug;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.DirectorSettings;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.types.enums.FlowModeEnum;
import com.voicetutor.types.enums.IntentEnum;
import com.voicetutor.types.enums.MindStateEnum;
import com.voicetutor.types.enums.OutputActionEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 规则导演：取首个候选节拍，按助手轮次轮换角色。
 */
public class HeuristicDirectorService implements DirectorService {

    private final DirectorPolicyDomainService policy;

    public HeuristicDirectorService(DirectorPolicyDomainService policy) {
        this.policy = policy;
    }

    @Override
    public DirectorPlan decide(SessionStateEntity snapshot, TimelineEventEntity event, DirectorSettings settings) {
        String userText = event == null ? "" : event.userText();
        FlowModeEnum flowMode = policy.inferFlowMode(snapshot, userText, settings);
        List<MindStateEnum> mindStates = policy.inferMindStates(snapshot, userText);
        IntentEnum intent = policy.classifyIntent(userText);
        List<String> candidates = policy.beatCandidates(snapshot, flowMode, mindStates, settings);

        String beat = candidates.get(0);
        String role = policy.rotateRole(snapshot, settings);
        OutputActionEnum outputAction = BeatLibrary.outputActionOf(beat);

        DirectorPlan plan = new DirectorPlan();
        plan.setUserMindState(mindStates);
        plan.setFlowMode(flowMode);
        plan.setIntent(intent);
        plan.setNextBeat(beat);
        plan.setNextRole(role);
        plan.setOutputAction(outputAction);
        plan.setUserMustDo(policy.userMustDoFor(outputAction));
        plan.setTalkBurstLimitSec(policy.talkBurstLimit(snapshot, settings));
        plan.setTensionGoal(policy.goalFor(snapshot.getTensionLevel(), settings));
        plan.setLoadGoal(policy.goalFor(snapshot.getCognitiveLoad(), settings));
        plan.setStackAction(policy.decideStackAction(snapshot, intent));
        plan.setNotes("heuristic plan for " + StringUtils.defaultIfBlank(snapshot.getMainObjective(), "session"));

        DirectorDebug debug = new DirectorDebug();
        debug.setSource(DirectorPolicyDomainService.SOURCE_HEURISTIC);
        debug.setBeatCandidates(candidates);
        debug.setBeatChoiceReason(policy.isOutputClockExceeded(snapshot, settings)
                ? "output clock " + snapshot.getOutputClockSec() + "s reached threshold, first pacing candidate"
                : "first candidate for " + flowMode + " " + mindStates);
        debug.setRoleChoiceReason("rotate by assistant turns " + snapshot.assistantTurnCount()
                + " over " + settings.resolveRoles(snapshot));
        plan.setDebug(debug);
        return policy.applyGuardrails(plan, snapshot, settings);
    }
}

package com.voicetutor.trigger.application.common;

import com.voicetutor.api.dto.AssistantMessageDTO;
import com.voicetutor.api.dto.BranchQuestionDTO;
import com.voicetutor.api.dto.ConversationTurnDTO;
import com.voicetutor.api.dto.DirectorDebugDTO;
import com.voicetutor.api.dto.DirectorPlanDTO;
import com.voicetutor.api.dto.InstructionsDTO;
import com.voicetutor.api.dto.LearningEntryDTO;
import com.voicetutor.api.dto.QuizQuestionDTO;
import com.voicetutor.api.dto.SessionCreateResponseDTO;
import com.voicetutor.api.dto.SessionEventRequestDTO;
import com.voicetutor.api.dto.SessionEventResponseDTO;
import com.voicetutor.api.dto.SessionReplayDTO;
import com.voicetutor.api.dto.SessionStateDTO;
import com.voicetutor.api.dto.TimelineEventDTO;
import com.voicetutor.api.dto.TurnDebugDTO;
import com.voicetutor.api.dto.UserActionDTO;
import com.voicetutor.domain.director.model.valobj.DirectorDebug;
import com.voicetutor.domain.director.model.valobj.DirectorPlan;
import com.voicetutor.domain.director.model.valobj.UserMustDo;
import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import com.voicetutor.domain.session.model.valobj.BranchQuestion;
import com.voicetutor.domain.session.model.valobj.ConversationTurn;
import com.voicetutor.domain.session.model.valobj.LearningEntry;
import com.voicetutor.domain.session.model.valobj.QuizQuestion;
import com.voicetutor.domain.timeline.model.entity.TimelineEventEntity;
import com.voicetutor.trigger.application.command.SessionCommandService;
import com.voicetutor.trigger.application.command.SessionEventCommandService;
import com.voicetutor.trigger.application.query.SessionQueryService;
import com.voicetutor.types.enums.MindStateEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 领域对象到接口 DTO 的转换。
 */
@Component
public class SessionDtoAssembler {

    public TimelineEventEntity toEvent(SessionEventRequestDTO request) {
        TimelineEventEntity event = new TimelineEventEntity();
        event.setEventId(request.getEventId());
        event.setTurnId(request.getTurnId());
        event.setType(request.getType());
        event.setText(request.getText());
        event.setQuestionId(request.getQuestionId());
        event.setAnswer(request.getAnswer());
        event.setClientTimestamp(request.getClientTimestamp());
        return event;
    }

    public SessionEventResponseDTO toEventResponse(SessionEventCommandService.SessionEventResult result) {
        AssistantMessageDTO assistant = new AssistantMessageDTO();
        assistant.setText(result.getAssistantText());
        assistant.setNeedUserAction(toUserAction(result.getNeedUserAction()));

        TurnDebugDTO debug = new TurnDebugDTO();
        debug.setSessionId(result.getSessionId());
        debug.setTurnId(result.getTurnId());
        debug.setUserSeq(result.getUserSeq());
        debug.setPlanSeq(result.getPlanSeq());
        debug.setReplySeq(result.getReplySeq());
        debug.setDuplicate(result.isDuplicate());
        debug.setPromptFallback(result.isPromptFallback());
        debug.setUtteranceFallback(result.isUtteranceFallback());
        debug.setDirectorPlan(toPlan(result.getPlan()));

        SessionEventResponseDTO response = new SessionEventResponseDTO();
        response.setAssistant(assistant);
        response.setDebug(debug);
        return response;
    }

    public SessionCreateResponseDTO toCreateResponse(SessionCommandService.SessionOpenResult result) {
        SessionCreateResponseDTO response = new SessionCreateResponseDTO();
        response.setSessionId(result.state().getSessionId());
        response.setState(toState(result.state()));
        List<QuizQuestionDTO> diagnose = new ArrayList<>();
        if (result.diagnose() != null) {
            for (QuizQuestion question : result.diagnose()) {
                diagnose.add(toQuiz(question));
            }
        }
        response.setDiagnose(diagnose);
        return response;
    }

    public SessionStateDTO toState(SessionStateEntity state) {
        if (state == null) {
            return null;
        }
        SessionStateDTO dto = new SessionStateDTO();
        dto.setSessionId(state.getSessionId());
        dto.setEntryId(state.getEntryId());
        dto.setDomain(state.getDomain());
        dto.setAvailableRoles(new ArrayList<>(state.getAvailableRoles()));
        dto.setMainObjective(state.getMainObjective());
        dto.setAct(state.getAct());
        dto.setBeat(state.getBeat());
        dto.setPacingMode(state.getPacingMode());
        dto.setMasteryEstimate(state.getMasteryEstimate());
        dto.setMisconceptionTags(new ArrayList<>(state.getMisconceptionTags()));
        dto.setOutputClockSec(state.getOutputClockSec());
        dto.setLastOutputAt(state.getLastOutputAt());
        dto.setTensionLevel(state.getTensionLevel());
        dto.setCognitiveLoad(state.getCognitiveLoad());
        List<BranchQuestionDTO> stack = new ArrayList<>();
        for (BranchQuestion question : state.getQuestionStack()) {
            BranchQuestionDTO item = new BranchQuestionDTO();
            item.setQuestionId(question.getQuestionId());
            item.setPrompt(question.getPrompt());
            stack.add(item);
        }
        dto.setQuestionStack(stack);
        if (state.getSignals() != null) {
            dto.setLastUserChars(state.getSignals().getLastUserChars());
            dto.setLastUserLatencyMs(state.getSignals().getLastUserLatencyMs());
        }
        List<ConversationTurnDTO> turns = new ArrayList<>();
        for (ConversationTurn turn : state.getTurns()) {
            ConversationTurnDTO item = new ConversationTurnDTO();
            item.setRole(turn.getRole() == null ? null : turn.getRole().getCode());
            item.setText(turn.getText());
            item.setTimestamp(turn.getTimestamp());
            turns.add(item);
        }
        dto.setTurns(turns);
        dto.setCreatedAt(state.getCreatedAt());
        dto.setUpdatedAt(state.getUpdatedAt());
        return dto;
    }

    public List<TimelineEventDTO> toTimeline(List<TimelineEventEntity> events) {
        List<TimelineEventDTO> result = new ArrayList<>();
        for (TimelineEventEntity event : events) {
            TimelineEventDTO dto = new TimelineEventDTO();
            dto.setSeq(event.getSeq());
            dto.setEventId(event.getEventId());
            dto.setTurnId(event.getTurnId());
            dto.setType(event.getType());
            dto.setText(event.getText());
            dto.setQuestionId(event.getQuestionId());
            dto.setAnswer(event.getAnswer());
            dto.setClientTimestamp(event.getClientTimestamp());
            dto.setServerTimestamp(event.getServerTimestamp());
            dto.setDirectorPlan(toPlan(event.getDirectorPlan()));
            result.add(dto);
        }
        return result;
    }

    public SessionReplayDTO toReplay(SessionQueryService.SessionReplayResult result) {
        SessionReplayDTO dto = new SessionReplayDTO();
        dto.setSessionId(result.sessionId());
        dto.setEventCount(result.eventCount());
        dto.setConsistent(result.consistent());
        dto.setRebuilt(toState(result.rebuilt()));
        return dto;
    }

    public InstructionsDTO toInstructions(SessionQueryService.InitialInstructionsResult result) {
        InstructionsDTO dto = new InstructionsDTO();
        dto.setSessionId(result.sessionId());
        dto.setInstructions(result.instructions());
        dto.setFallback(result.fallback());
        dto.setDirectorPlan(toPlan(result.plan()));
        return dto;
    }

    public List<LearningEntryDTO> toEntries(List<LearningEntry> entries) {
        List<LearningEntryDTO> result = new ArrayList<>();
        for (LearningEntry entry : entries) {
            LearningEntryDTO dto = new LearningEntryDTO();
            dto.setEntryId(entry.getEntryId());
            dto.setDomain(entry.getDomain());
            dto.setTitle(entry.getTitle());
            dto.setSubtitle(entry.getSubtitle());
            dto.setRoles(entry.getRoles() == null ? new ArrayList<>() : new ArrayList<>(entry.getRoles()));
            dto.setMetaphor(entry.getMetaphor());
            result.add(dto);
        }
        return result;
    }

    public DirectorPlanDTO toPlan(DirectorPlan plan) {
        if (plan == null) {
            return null;
        }
        DirectorPlanDTO dto = new DirectorPlanDTO();
        List<String> mindStates = new ArrayList<>();
        if (plan.getUserMindState() != null) {
            for (MindStateEnum mindState : plan.getUserMindState()) {
                mindStates.add(mindState.getCode());
            }
        }
        dto.setUserMindState(mindStates);
        dto.setFlowMode(plan.getFlowMode() == null ? null : plan.getFlowMode().name());
        dto.setIntent(plan.getIntent() == null ? null : plan.getIntent().getCode());
        dto.setNextBeat(plan.getNextBeat());
        dto.setNextRole(plan.getNextRole());
        dto.setOutputAction(plan.getOutputAction() == null ? null : plan.getOutputAction().getCode());
        dto.setUserMustDo(toUserAction(plan.getUserMustDo()));
        dto.setTalkBurstLimitSec(plan.getTalkBurstLimitSec());
        dto.setTensionGoal(plan.getTensionGoal() == null ? null : plan.getTensionGoal().getCode());
        dto.setLoadGoal(plan.getLoadGoal() == null ? null : plan.getLoadGoal().getCode());
        dto.setStackAction(plan.getStackAction() == null ? null : plan.getStackAction().getCode());
        dto.setNotes(plan.getNotes());
        dto.setDebug(toDebug(plan.getDebug()));
        return dto;
    }

    private DirectorDebugDTO toDebug(DirectorDebug debug) {
        if (debug == null) {
            return null;
        }
        DirectorDebugDTO dto = new DirectorDebugDTO();
        dto.setSource(debug.getSource());
        dto.setBeatCandidates(new ArrayList<>(debug.getBeatCandidates()));
        dto.setBeatChoiceReason(debug.getBeatChoiceReason());
        dto.setRoleChoiceReason(debug.getRoleChoiceReason());
        dto.setGuardrailNotes(new ArrayList<>(debug.getGuardrailNotes()));
        dto.setFallbackReason(debug.getFallbackReason());
        return dto;
    }

    private UserActionDTO toUserAction(UserMustDo userMustDo) {
        if (userMustDo == null) {
            return null;
        }
        UserActionDTO dto = new UserActionDTO();
        dto.setType(userMustDo.getType() == null ? null : userMustDo.getType().getCode());
        dto.setPrompt(userMustDo.getPrompt());
        return dto;
    }

    private QuizQuestionDTO toQuiz(QuizQuestion question) {
        QuizQuestionDTO dto = new QuizQuestionDTO();
        dto.setQuestionId(question.getQuestionId());
        dto.setPrompt(question.getPrompt());
        dto.setOptions(question.getOptions() == null ? new ArrayList<>() : new ArrayList<>(question.getOptions()));
        return dto;
    }
}

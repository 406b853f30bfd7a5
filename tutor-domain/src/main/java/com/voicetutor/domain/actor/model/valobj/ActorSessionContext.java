package com.voicetutor.domain.actor.model.valobj;

import com.voicetutor.domain.session.model.entity.SessionStateEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 组装指令所需的会话上下文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActorSessionContext {

    private String sessionId;
    private String turnId;
    private String mainObjective;
    private String metaphor;
    private String lastUserText;
    private String pendingQuestion;

    public static ActorSessionContext from(SessionStateEntity state, String turnId, String lastUserText) {
        return ActorSessionContext.builder()
                .sessionId(state.getSessionId())
                .turnId(turnId)
                .mainObjective(state.getMainObjective())
                .metaphor(state.getMetaphor())
                .lastUserText(lastUserText)
                .pendingQuestion(state.peekBranchQuestion() == null ? null : state.peekBranchQuestion().getPrompt())
                .build();
    }
}

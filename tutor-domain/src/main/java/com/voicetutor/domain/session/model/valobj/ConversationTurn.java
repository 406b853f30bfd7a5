package com.voicetutor.domain.session.model.valobj;

import com.voicetutor.types.enums.MessageRoleEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对话轮次。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    private MessageRoleEnum role;
    private String text;
    private LocalDateTime timestamp;

    public boolean isAssistant() {
        return role == MessageRoleEnum.ASSISTANT;
    }
}

package com.voicetutor.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对话轮次 DTO。
 */
@Data
public class ConversationTurnDTO {

    private String role;
    private String text;
    private LocalDateTime timestamp;
}

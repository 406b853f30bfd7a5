package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 会话事件处理结果 DTO。
 */
@Data
public class SessionEventResponseDTO {

    private AssistantMessageDTO assistant;
    private TurnDebugDTO debug;
}

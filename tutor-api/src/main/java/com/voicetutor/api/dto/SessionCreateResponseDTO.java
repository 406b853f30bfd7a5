package com.voicetutor.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 开启会话响应 DTO：会话快照与开场诊断题。
 */
@Data
public class SessionCreateResponseDTO {

    private String sessionId;
    private SessionStateDTO state;
    private List<QuizQuestionDTO> diagnose;
}

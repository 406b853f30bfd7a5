package com.voicetutor.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话快照 DTO。
 */
@Data
public class SessionStateDTO {

    private String sessionId;
    private String entryId;
    private String domain;
    private List<String> availableRoles;
    private String mainObjective;
    private Integer act;
    private String beat;
    private String pacingMode;
    private Double masteryEstimate;
    private List<String> misconceptionTags;
    private Long outputClockSec;
    private LocalDateTime lastOutputAt;
    private Integer tensionLevel;
    private Integer cognitiveLoad;
    private List<BranchQuestionDTO> questionStack;
    private Integer lastUserChars;
    private Long lastUserLatencyMs;
    private List<ConversationTurnDTO> turns;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

package com.voicetutor.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 导演决策调试 DTO。
 */
@Data
public class DirectorDebugDTO {

    private String source;
    private List<String> beatCandidates;
    private String beatChoiceReason;
    private String roleChoiceReason;
    private List<String> guardrailNotes;
    private String fallbackReason;
}

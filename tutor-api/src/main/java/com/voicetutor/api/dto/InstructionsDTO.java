package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 开场指令 DTO。
 */
@Data
public class InstructionsDTO {

    private String sessionId;
    private String instructions;
    private Boolean fallback;
    private DirectorPlanDTO directorPlan;
}

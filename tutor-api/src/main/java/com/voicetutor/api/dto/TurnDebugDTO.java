package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 单轮调试信息 DTO。
 */
@Data
public class TurnDebugDTO {

    private String sessionId;
    private String turnId;
    private Long userSeq;
    private Long planSeq;
    private Long replySeq;
    private Boolean duplicate;
    private Boolean promptFallback;
    private Boolean utteranceFallback;
    private DirectorPlanDTO directorPlan;
}

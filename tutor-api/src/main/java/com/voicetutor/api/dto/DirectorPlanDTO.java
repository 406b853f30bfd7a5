package com.voicetutor.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 导演计划 DTO。
 */
@Data
public class DirectorPlanDTO {

    private List<String> userMindState;
    private String flowMode;
    private String intent;
    private String nextBeat;
    private String nextRole;
    private String outputAction;
    private UserActionDTO userMustDo;
    private Integer talkBurstLimitSec;
    private String tensionGoal;
    private String loadGoal;
    private String stackAction;
    private String notes;
    private DirectorDebugDTO debug;
}

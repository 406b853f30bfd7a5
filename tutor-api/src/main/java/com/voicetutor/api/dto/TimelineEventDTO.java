package com.voicetutor.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 时间线事件 DTO。
 */
@Data
public class TimelineEventDTO {

    private Long seq;
    private String eventId;
    private String turnId;
    private String type;
    private String text;
    private String questionId;
    private String answer;
    private LocalDateTime clientTimestamp;
    private LocalDateTime serverTimestamp;
    private DirectorPlanDTO directorPlan;
}

package com.voicetutor.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 学习入口 DTO。
 */
@Data
public class LearningEntryDTO {

    private String entryId;
    private String domain;
    private String title;
    private String subtitle;
    private List<String> roles;
    private String metaphor;
}

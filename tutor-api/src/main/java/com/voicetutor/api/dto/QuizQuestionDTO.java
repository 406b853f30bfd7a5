package com.voicetutor.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 选择题 DTO。
 */
@Data
public class QuizQuestionDTO {

    private String questionId;
    private String prompt;
    private List<String> options;
}

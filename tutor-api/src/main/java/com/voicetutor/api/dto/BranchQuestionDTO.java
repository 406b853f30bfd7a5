package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 待回到的分支问题 DTO。
 */
@Data
public class BranchQuestionDTO {

    private String questionId;
    private String prompt;
}

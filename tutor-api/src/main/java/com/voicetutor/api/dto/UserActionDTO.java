package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 学习者需要完成的动作。
 */
@Data
public class UserActionDTO {

    private String type;
    private String prompt;
}

package com.voicetutor.api.dto;

import lombok.Data;

/**
 * 助手消息 DTO。
 */
@Data
public class AssistantMessageDTO {

    private String text;
    private UserActionDTO needUserAction;
}

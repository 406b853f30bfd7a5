package com.voicetutor.types.enums;

/**
 * 对话轮次的发言方。
 */
public enum MessageRoleEnum {
    USER("user"),
    ASSISTANT("assistant");

    private final String code;

    MessageRoleEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

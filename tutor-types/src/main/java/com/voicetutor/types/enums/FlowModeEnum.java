package com.voicetutor.types.enums;

/**
 * 对话流模式：顺畅推进或救场。
 */
public enum FlowModeEnum {
    FLOW,
    RESCUE;

    public static FlowModeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (FlowModeEnum value : values()) {
            if (value.name().equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}

package com.voicetutor.types.enums;

/**
 * 张力、负荷等指标的调节方向。
 */
public enum GoalDirectionEnum {
    INCREASE("increase"),
    DECREASE("decrease"),
    KEEP("keep");

    private final String code;

    GoalDirectionEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static GoalDirectionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (GoalDirectionEnum value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}

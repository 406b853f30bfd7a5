package com.voicetutor.types.enums;

/**
 * 学习者心智状态标签。
 */
public enum MindStateEnum {

    /** 概念混乱 */
    FOG("Fog"),
    /** 自以为懂 */
    ILLUSION("Illusion"),
    /** 部分理解 */
    PARTIAL("Partial"),
    /** 顿悟 */
    AHA("Aha"),
    /** 想要确认 */
    VERIFY("Verify"),
    /** 想要展开 */
    EXPAND("Expand"),
    /** 疲劳 */
    FATIGUE("Fatigue"),
    /** 正常投入 */
    ENGAGED("Engaged");

    private final String code;

    MindStateEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static MindStateEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (MindStateEnum value : values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }
}

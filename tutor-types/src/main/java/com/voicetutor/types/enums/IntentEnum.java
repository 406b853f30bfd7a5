package com.voicetutor.types.enums;

/**
 * 用户意图分类。
 */
public enum IntentEnum {
    CLARIFY("Clarify"),
    DEEPEN("Deepen"),
    BRANCH("Branch"),
    META("Meta"),
    OFF_TOPIC("OffTopic"),
    CONTINUE("Continue");

    private final String code;

    IntentEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static IntentEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().replace("_", "").replace("-", "");
        for (IntentEnum value : values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }
}

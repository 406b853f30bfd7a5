package com.voicetutor.types.enums;

/**
 * 分支问题栈操作。
 */
public enum StackActionEnum {
    PUSH("push"),
    POP("pop"),
    KEEP("keep");

    private final String code;

    StackActionEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static StackActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StackActionEnum value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}

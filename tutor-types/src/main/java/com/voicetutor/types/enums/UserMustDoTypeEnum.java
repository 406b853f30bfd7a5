package com.voicetutor.types.enums;

/**
 * 学习者必须产出的内容类型。
 */
public enum UserMustDoTypeEnum {
    TEACH_BACK("teach_back"),
    CHOICE("choice"),
    EXAMPLE("example"),
    BOUNDARY("boundary"),
    TRANSFER("transfer");

    private final String code;

    UserMustDoTypeEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static UserMustDoTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().replace("-", "_");
        for (UserMustDoTypeEnum value : values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }
}

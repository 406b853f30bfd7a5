package com.voicetutor.types.enums;

import org.apache.commons.lang3.StringUtils;

/**
 * 时间线事件类型。
 * <p>
 * 事件类型在时间线上以字符串保存，未登记的类型按用户文本事件处理。
 * </p>
 */
public enum EventTypeEnum {

    USER_MESSAGE("user_message"),
    USER_UTTERANCE("user_utterance"),
    ASSISTANT_TEXT("assistant_text"),
    QUIZ_ANSWER("quiz_answer"),
    DIRECTOR_PLAN("director_plan"),
    SESSION_STARTED("session_started"),
    BARGE_IN("barge_in"),
    WORLD_ENTERED("world_entered");

    private final String code;

    EventTypeEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 按编码查找，未知编码返回 null。
     */
    public static EventTypeEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        for (EventTypeEnum value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}

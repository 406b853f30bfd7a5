package com.voicetutor.types.enums;

/**
 * 本轮输出动作。
 * <p>
 * 绑定了 {@link UserMustDoTypeEnum} 的动作要求学习者产出内容，属于“产出型”动作。
 * </p>
 */
public enum OutputActionEnum {

    EXPLAIN_WITH_METAPHOR("explain_with_metaphor", null),
    ASK_SIMPLE_QUESTION("ask_simple_question", UserMustDoTypeEnum.CHOICE),
    ASK_ELABORATION("ask_elaboration", UserMustDoTypeEnum.EXAMPLE),
    CHALLENGE_ASSUMPTION("challenge_assumption", UserMustDoTypeEnum.BOUNDARY),
    ACKNOWLEDGE_AND_CONTINUE("acknowledge_and_continue", null),
    REFRAME_PERSPECTIVE("reframe_perspective", UserMustDoTypeEnum.BOUNDARY),
    ASK_TEACH_BACK("ask_teach_back", UserMustDoTypeEnum.TEACH_BACK),
    SHOW_MULTIPLE_EXAMPLES("show_multiple_examples", UserMustDoTypeEnum.EXAMPLE),
    ENGAGE_INTERACTIVE("engage_interactive", UserMustDoTypeEnum.CHOICE),
    ASSESS_TRANSFER("assess_transfer", UserMustDoTypeEnum.TRANSFER),
    RECAP("recap", UserMustDoTypeEnum.TEACH_BACK),
    CONTINUE_DIALOGUE("continue_dialogue", null);

    private final String code;
    private final UserMustDoTypeEnum userMustDoType;

    OutputActionEnum(String code, UserMustDoTypeEnum userMustDoType) {
        this.code = code;
        this.userMustDoType = userMustDoType;
    }

    public String getCode() {
        return code;
    }

    public UserMustDoTypeEnum getUserMustDoType() {
        return userMustDoType;
    }

    public boolean isOutputProducing() {
        return userMustDoType != null;
    }

    /**
     * 按编码查找，未知编码返回 null。
     */
    public static OutputActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (OutputActionEnum value : values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }
}

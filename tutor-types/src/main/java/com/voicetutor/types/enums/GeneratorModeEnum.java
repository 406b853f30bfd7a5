package com.voicetutor.types.enums;

/**
 * 助手话术生成方式。
 */
public enum GeneratorModeEnum {
    /** 固定确认语 */
    STUB,
    /** 调用大模型 */
    LLM
}

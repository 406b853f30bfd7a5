package com.voicetutor.types.enums;

/**
 * 导演策略实现方式。
 */
public enum DirectorModeEnum {
    /** 本地规则 */
    HEURISTIC,
    /** 委托外部模型 */
    DELEGATED
}

package com.voicetutor.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 00xx 为通用码，01xx 为提示词校验类，02xx 为外部服务类，03xx 为存储类。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话不存在 */
    SESSION_NOT_FOUND("0003", "会话不存在"),

    /** 学习入口不存在 */
    ENTRY_NOT_FOUND("0004", "学习入口不存在"),

    /** 角色或节拍模板不存在 */
    TEMPLATE_NOT_FOUND("0101", "模板不存在"),

    /** 提示词校验失败 */
    PROMPT_VALIDATION_FAILED("0102", "提示词校验失败"),

    /** 导演未给出可执行指令 */
    EMPTY_INSTRUCTION("0103", "导演指令为空"),

    /** 外部决策或生成服务失败 */
    EXTERNAL_SERVICE_ERROR("0201", "外部服务调用失败"),

    /** 存储失败 */
    STORE_FAILURE("0301", "存储失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

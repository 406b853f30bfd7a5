package com.voicetutor.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 成功时 code 为 "0000"，失败时 code 取自服务端响应码，data 为空。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author voicetutor
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = -3174209861054822130L;

    public static final String SUCCESS_CODE = "0000";
    public static final String SUCCESS_INFO = "成功";

    /** 响应码 */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

    public static <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(SUCCESS_CODE)
                .info(SUCCESS_INFO)
                .data(data)
                .build();
    }

    public static <T> Response<T> failure(String code, String info) {
        return Response.<T>builder()
                .code(code)
                .info(info)
                .build();
    }

}

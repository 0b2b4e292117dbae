package com.taskadmin.api.response;

import com.taskadmin.types.enums.ResponseCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * API 响应信封：{@code code} 为 {@link ResponseCode} 的编码，{@code data} 仅在成功时填充。
 *
 * @param <T> 响应数据的类型
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 3185527410264319870L;

    private String code;

    private String info;

    private T data;

    public static <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    /**
     * 失败响应，info 为空时回退到响应码的默认描述。
     */
    public static <T> Response<T> failure(ResponseCode responseCode, String info) {
        return failure(responseCode.getCode(), info == null || info.isBlank() ? responseCode.getInfo() : info);
    }

    public static <T> Response<T> failure(String code, String info) {
        return Response.<T>builder()
                .code(code)
                .info(info)
                .build();
    }

}

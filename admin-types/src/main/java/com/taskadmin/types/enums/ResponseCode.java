package com.taskadmin.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 非法 ID（非正整数） */
    INVALID_ID("0003", "非法ID"),

    /** 外部执行实例 ID 非法（非 UUID） */
    INVALID_EXTERNAL_ID("0004", "非法外部执行ID"),

    /** 实体不存在 */
    NOT_FOUND("0005", "记录不存在"),

    /** 存储层失败 */
    PERSISTENCE_ERROR("0006", "存储访问失败"),

    /** 缓存存储不可用 */
    CACHE_UNAVAILABLE("0007", "缓存不可用"),

    /** 派生字段解析失败 */
    MAPPING_ERROR("0008", "数据映射失败"),

    /** 请求中缺少身份上下文 */
    NO_AUTH_CONTEXT("0009", "未登录或登录态已失效"),

    /** 身份声明格式非法 */
    INVALID_CLAIMS("0010", "身份声明非法"),

    /** 角色无外部映射 */
    INVALID_ROLE("0011", "非法角色"),

    /** 身份提供方调用失败 */
    IDENTITY_PROVIDER_ERROR("0012", "身份服务调用失败"),

    /** 权限不足 */
    FORBIDDEN("0013", "权限不足");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

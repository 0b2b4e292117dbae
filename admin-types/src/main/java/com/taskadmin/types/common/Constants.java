package com.taskadmin.types.common;

/**
 * 全局常量定义类。
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public class Constants {

    /** 请求域身份声明属性名 */
    public final static String REQ_ATTR_AUTH_CLAIMS = "auth.claims";

    /** 任务缓存命名空间 */
    public final static String TASK_CACHE_NAME = "task";

    /** 身份提供方全量翻页的固定页大小 */
    public final static int IDENTITY_SWEEP_PAGE_SIZE = 100;

}

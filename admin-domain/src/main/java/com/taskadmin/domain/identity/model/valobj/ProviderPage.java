package com.taskadmin.domain.identity.model.valobj;

import java.util.List;

/**
 * 身份提供方分页结果。
 *
 * @param items 当前页数据
 * @param start 当前页起始偏移
 * @param length 当前页条数
 * @param total 总条数
 * @param <T> 数据类型
 */
public record ProviderPage<T>(List<T> items, long start, long length, long total) {

    /**
     * 是否还有下一页：start + length < total，空页视为结束。
     */
    public boolean hasNext() {
        if (items == null || items.isEmpty()) {
            return false;
        }
        return start + length < total;
    }
}

package com.taskadmin.domain.identity.model.valobj;

import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;

import java.util.List;

/**
 * 单页用户查询结果。
 *
 * @param users 当前页用户
 * @param total 身份提供方报告的总数
 */
public record UserPageResult(List<IdentityUserEntity> users, long total) {
}

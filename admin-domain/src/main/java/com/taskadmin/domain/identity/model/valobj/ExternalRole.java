package com.taskadmin.domain.identity.model.valobj;

/**
 * 身份提供方角色对象（以稳定的不透明 ID 标识）。
 *
 * @param id 外部角色 ID
 * @param name 外部角色名称
 */
public record ExternalRole(String id, String name) {
}

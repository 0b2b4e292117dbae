/**
 * Identity 领域 - 用户与角色
 *
 * <p>职责：通过外部身份提供方读写用户资料与角色，并在本地三级角色模型
 * （User / Member / Admin）与外部角色对象之间做双向映射。用户资料不做本地持久化。</p>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>UserRoleMapper - 本地角色与外部角色对象的双向映射</li>
 *   <li>UserIdentityDomainService - 身份提供方网关：翻页全量拉取、角色分配 / 回收</li>
 * </ul>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
package com.taskadmin.domain.identity;

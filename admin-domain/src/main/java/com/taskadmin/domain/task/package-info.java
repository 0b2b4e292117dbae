/**
 * Task 领域 - 任务 / 运行 / 产物
 *
 * <p>职责：任务定义的登记与维护，运行记录与产物的只读查询。任务的执行本身由外部执行系统负责。</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Task - 用户提交的任务（关系库，软删除）</li>
 *   <li>TaskRun - 任务运行记录（关系库，状态由外部驱动）</li>
 *   <li>TaskRunArtifact - 运行产物（宽表存储，按外部执行实例 ID 分区）</li>
 * </ul>
 *
 * <h3>端口</h3>
 * <ul>
 *   <li>{@link com.taskadmin.domain.task.adapter.repository.ITaskRepository}</li>
 *   <li>{@link com.taskadmin.domain.task.adapter.repository.ITaskRunRepository}</li>
 *   <li>{@link com.taskadmin.domain.task.adapter.repository.ITaskRunArtifactRepository}</li>
 *   <li>{@link com.taskadmin.domain.task.adapter.cache.ICacheStore}</li>
 * </ul>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
package com.taskadmin.domain.task;

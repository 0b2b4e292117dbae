package com.taskadmin.infrastructure.dao;

import com.taskadmin.infrastructure.dao.po.TaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务 DAO
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Mapper
public interface TaskDao {

    /**
     * 插入任务
     */
    int insert(TaskPO po);

    /**
     * 更新名称、定义与更新时间（仅未删除的任务）
     */
    int update(TaskPO po);

    /**
     * 软删除
     */
    int softDelete(@Param("id") Long id, @Param("deletedAt") LocalDateTime deletedAt);

    /**
     * 根据 ID 查询未删除的任务
     */
    TaskPO selectById(@Param("id") Long id);

    /**
     * 根据提交人查询未删除的任务
     */
    List<TaskPO> selectByOwner(@Param("owner") String owner);
}

package com.taskadmin.infrastructure.dao;

import com.taskadmin.infrastructure.dao.po.TaskRunPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务运行记录 DAO
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Mapper
public interface TaskRunDao {

    /**
     * 根据 ID 查询
     */
    TaskRunPO selectById(@Param("id") Long id);

    /**
     * 根据任务 ID 查询
     */
    List<TaskRunPO> selectByTaskId(@Param("taskId") Long taskId);

    /**
     * 查询任务最近创建的一次运行
     */
    TaskRunPO selectLatestByTaskId(@Param("taskId") Long taskId);
}

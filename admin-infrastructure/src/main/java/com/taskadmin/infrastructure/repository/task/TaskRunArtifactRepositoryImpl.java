package com.taskadmin.infrastructure.repository.task;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.taskadmin.domain.task.adapter.repository.ITaskRunArtifactRepository;
import com.taskadmin.domain.task.model.entity.TaskRunArtifactEntity;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 任务运行产物仓储实现类（Cassandra）。
 * <p>
 * 表 {@code task_run_artifacts} 以 {@code execution_instance_id} 为分区键。
 * CQL 不支持 OFFSET，因此按 {@code offset + limit} 请求行数，由驱动分页拉取后在客户端跳过前 offset 行。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class TaskRunArtifactRepositoryImpl implements ITaskRunArtifactRepository {

    static final String SELECT_BY_EXECUTION_INSTANCE = "SELECT execution_instance_id, execution_task_id, artifact_id, "
            + "created_at, artifact_type, url, content_type, content_length, status_code, additional_data "
            + "FROM task_run_artifacts WHERE execution_instance_id = ? LIMIT ?";

    private final CqlSession cqlSession;
    private final int fetchSize;

    public TaskRunArtifactRepositoryImpl(CqlSession cqlSession,
                                         @Value("${app.task.artifact.fetch-size:100}") int fetchSize) {
        this.cqlSession = cqlSession;
        this.fetchSize = Math.max(1, fetchSize);
    }

    @Override
    public List<TaskRunArtifactEntity> listByExecutionInstanceId(UUID executionInstanceId, int limit, int offset) {
        if (executionInstanceId == null || limit <= 0) {
            return Collections.emptyList();
        }
        int skip = Math.max(0, offset);
        int rowLimit = (int) Math.min(Integer.MAX_VALUE, (long) skip + limit);
        try {
            PreparedStatement prepared = cqlSession.prepare(SELECT_BY_EXECUTION_INSTANCE);
            BoundStatement statement = prepared.bind(executionInstanceId, rowLimit).setPageSize(fetchSize);
            ResultSet resultSet = cqlSession.execute(statement);

            List<TaskRunArtifactEntity> artifacts = new ArrayList<>(Math.min(limit, fetchSize));
            int index = 0;
            for (Row row : resultSet) {
                if (index++ < skip) {
                    continue;
                }
                artifacts.add(toEntity(row));
                if (artifacts.size() >= limit) {
                    break;
                }
            }
            return artifacts;
        } catch (DriverException ex) {
            log.error("Artifact query failed. executionInstanceId={}, limit={}, offset={}, error={}",
                    executionInstanceId, limit, offset, ex.getMessage());
            throw new AppException(ResponseCode.PERSISTENCE_ERROR,
                    "Failed to list artifacts of execution instance " + executionInstanceId, ex);
        }
    }

    /**
     * Row 转换为 Entity
     */
    private TaskRunArtifactEntity toEntity(Row row) {
        TaskRunArtifactEntity entity = new TaskRunArtifactEntity();
        entity.setExecutionInstanceId(row.getUuid("execution_instance_id"));
        entity.setExecutionTaskId(row.getUuid("execution_task_id"));
        entity.setArtifactId(row.getUuid("artifact_id"));
        entity.setCreatedAt(toLocalDateTime(row.getInstant("created_at")));
        entity.setArtifactType(row.getString("artifact_type"));
        entity.setUrl(row.getString("url"));
        entity.setContentType(row.getString("content_type"));
        entity.setContentLength(row.isNull("content_length") ? null : row.getLong("content_length"));
        entity.setStatusCode(row.isNull("status_code") ? null : row.getInt("status_code"));
        entity.setAdditionalData(row.getString("additional_data"));
        return entity;
    }

    private LocalDateTime toLocalDateTime(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }
}

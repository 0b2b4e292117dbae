package com.taskadmin.test.support;

import com.taskadmin.domain.task.adapter.repository.ITaskRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存任务仓储，记录读写次数。
 */
public class InMemoryTaskRepository implements ITaskRepository {

    private final Map<Long, TaskEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private int findByIdCalls;
    private int writeCalls;

    /**
     * 直接放入一条记录，不计入写次数。
     */
    public TaskEntity put(TaskEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        } else {
            nextId = Math.max(nextId, entity.getId() + 1);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        writeCalls++;
        entity.validate();
        return put(entity);
    }

    @Override
    public boolean update(TaskEntity entity) {
        writeCalls++;
        TaskEntity current = store.get(entity.getId());
        if (current == null || current.isDeleted()) {
            return false;
        }
        store.put(entity.getId(), entity);
        return true;
    }

    @Override
    public boolean softDelete(TaskEntity entity) {
        writeCalls++;
        TaskEntity current = store.get(entity.getId());
        if (current == null || current.isDeleted()) {
            return false;
        }
        current.setDeletedAt(entity.getDeletedAt());
        return true;
    }

    @Override
    public TaskEntity findById(Long id) {
        findByIdCalls++;
        TaskEntity entity = store.get(id);
        return entity == null || entity.isDeleted() ? null : entity;
    }

    @Override
    public List<TaskEntity> findByOwner(String owner) {
        return store.values().stream()
                .filter(task -> !task.isDeleted())
                .filter(task -> owner.equals(task.getOwner()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public TaskEntity raw(Long id) {
        return store.get(id);
    }

    public int getFindByIdCalls() {
        return findByIdCalls;
    }

    public int getWriteCalls() {
        return writeCalls;
    }
}

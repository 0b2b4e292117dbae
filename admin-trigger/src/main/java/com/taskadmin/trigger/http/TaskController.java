package com.taskadmin.trigger.http;

import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.api.dto.TaskRunDTO;
import com.taskadmin.api.dto.TaskUpsertRequestDTO;
import com.taskadmin.api.response.Response;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.trigger.application.command.TaskCommandService;
import com.taskadmin.trigger.application.common.CallerAccessGuard;
import com.taskadmin.trigger.application.common.TaskViewAssembler;
import com.taskadmin.trigger.application.query.TaskQueryService;
import com.taskadmin.types.common.Constants;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 任务管理 API。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskQueryService taskQueryService;
    private final TaskCommandService taskCommandService;
    private final TaskViewAssembler taskViewAssembler;
    private final CallerAccessGuard callerAccessGuard;

    public TaskController(TaskQueryService taskQueryService,
                          TaskCommandService taskCommandService,
                          TaskViewAssembler taskViewAssembler,
                          CallerAccessGuard callerAccessGuard) {
        this.taskQueryService = taskQueryService;
        this.taskCommandService = taskCommandService;
        this.taskViewAssembler = taskViewAssembler;
        this.callerAccessGuard = callerAccessGuard;
    }

    @GetMapping
    public Response<List<TaskDTO>> listMyTasks(
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        String subject = callerAccessGuard.requireSubject(claims);
        return Response.success(taskQueryService.getTasksByUser(subject));
    }

    @GetMapping("/{id}")
    public Response<TaskDTO> getTask(@PathVariable("id") String taskId) {
        return Response.success(taskQueryService.getTaskById(taskId));
    }

    @PostMapping
    public Response<TaskDTO> createTask(
            @RequestBody TaskUpsertRequestDTO request,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        String subject = callerAccessGuard.requireSubject(claims);
        TaskEntity task = taskCommandService.createTask(request, subject);
        return Response.success(taskViewAssembler.toTaskDTO(task));
    }

    @PutMapping("/{id}")
    public Response<TaskDTO> updateTask(
            @PathVariable("id") String taskId,
            @RequestBody TaskUpsertRequestDTO request,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        String subject = callerAccessGuard.requireSubject(claims);
        TaskEntity task = taskCommandService.updateTask(request, subject, taskId);
        return Response.success(taskViewAssembler.toTaskDTO(task));
    }

    @DeleteMapping("/{id}")
    public Response<Void> deleteTask(
            @PathVariable("id") String taskId,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        String subject = callerAccessGuard.requireSubject(claims);
        taskCommandService.deleteTask(taskId, subject);
        return Response.success(null);
    }

    @GetMapping("/{id}/runs")
    public Response<List<TaskRunDTO>> listTaskRuns(@PathVariable("id") String taskId) {
        return Response.success(taskQueryService.listTaskRuns(taskId));
    }
}

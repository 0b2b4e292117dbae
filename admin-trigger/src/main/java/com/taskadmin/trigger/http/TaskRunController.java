package com.taskadmin.trigger.http;

import com.taskadmin.api.dto.TaskRunArtifactDTO;
import com.taskadmin.api.response.Response;
import com.taskadmin.trigger.application.query.TaskQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 任务运行产物查询 API。
 */
@RestController
@RequestMapping("/api/task-runs")
public class TaskRunController {

    private final TaskQueryService taskQueryService;

    public TaskRunController(TaskQueryService taskQueryService) {
        this.taskQueryService = taskQueryService;
    }

    @GetMapping("/{id}/artifacts")
    public Response<List<TaskRunArtifactDTO>> listArtifacts(
            @PathVariable("id") String taskRunId,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "pageSize", defaultValue = "20") int pageSize) {
        return Response.success(taskQueryService.getTaskRunArtifacts(taskRunId, page, pageSize));
    }
}

package com.example.jobrunner.mapper;

import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.entity.CronExecution;
import com.example.jobrunner.domain.entity.CronJob;
import com.example.jobrunner.dto.CronExecutionResponse;
import com.example.jobrunner.dto.CronJobResponse;
import com.example.jobrunner.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting runner entities to response DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface RunnerMapper {

    CronJobResponse toJobResponse(CronJob job);

    List<CronJobResponse> toJobResponses(List<CronJob> jobs);

    CronExecutionResponse toExecutionResponse(CronExecution execution);

    List<CronExecutionResponse> toExecutionResponses(List<CronExecution> executions);

    TaskResponse toTaskResponse(AutomatedTask task);

    List<TaskResponse> toTaskResponses(List<AutomatedTask> tasks);
}

package com.example.jobrunner.domain.converter;

import com.example.jobrunner.domain.enums.TaskStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TaskStatus} as its lowercase code ({@code scheduled}, {@code running}, ...)
 */
@Converter
public class TaskStatusConverter implements AttributeConverter<TaskStatus, String> {

    @Override
    public String convertToDatabaseColumn(TaskStatus status) {
        return status != null ? status.getCode() : null;
    }

    @Override
    public TaskStatus convertToEntityAttribute(String code) {
        return code != null ? TaskStatus.fromCode(code) : null;
    }
}

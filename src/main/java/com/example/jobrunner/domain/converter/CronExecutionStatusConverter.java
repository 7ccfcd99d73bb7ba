package com.example.jobrunner.domain.converter;

import com.example.jobrunner.domain.enums.CronExecutionStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class CronExecutionStatusConverter implements AttributeConverter<CronExecutionStatus, String> {

    @Override
    public String convertToDatabaseColumn(CronExecutionStatus status) {
        return status != null ? status.getCode() : null;
    }

    @Override
    public CronExecutionStatus convertToEntityAttribute(String code) {
        return code != null ? CronExecutionStatus.fromCode(code) : null;
    }
}

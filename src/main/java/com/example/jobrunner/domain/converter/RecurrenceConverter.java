package com.example.jobrunner.domain.converter;

import com.example.jobrunner.domain.enums.Recurrence;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link Recurrence} as its lowercase code. A missing column value reads back as NONE.
 */
@Converter
public class RecurrenceConverter implements AttributeConverter<Recurrence, String> {

    @Override
    public String convertToDatabaseColumn(Recurrence recurrence) {
        return (recurrence != null ? recurrence : Recurrence.NONE).getCode();
    }

    @Override
    public Recurrence convertToEntityAttribute(String code) {
        return Recurrence.fromCode(code);
    }
}

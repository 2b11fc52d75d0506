package com.roomrank.roomrank_api.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;

/** Stores a team roster as a comma-separated id list ("1,3,5,8"). */
@Converter
public class ParticipantIdListConverter implements AttributeConverter<List<Long>, String> {

    @Override
    public String convertToDatabaseColumn(List<Long> ids) {
        if (ids == null || ids.isEmpty()) return "";
        return String.join(",", ids.stream().map(String::valueOf).toList());
    }

    @Override
    public List<Long> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return List.of();
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .map(Long::valueOf)
                .toList();
    }
}

package com.skyport.panel.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String error,
        Object details,
        List<String> missing,
        String suggestion
) {
    public static ApiError of(String error, Object details) {
        return new ApiError(error, details, null, null);
    }
}

package com.unihousing.backend.global.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope: {@code {"success": true, "message"?, "count"?, "data"}}.
 * Collection responses always carry {@code count}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, Integer count, T data) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, null, null, data);
    }

    public static <T> ApiResponse<T> of(String message, T data) {
        return new ApiResponse<>(true, message, null, data);
    }

    public static <E> ApiResponse<List<E>> list(List<E> items) {
        return new ApiResponse<>(true, null, items.size(), items);
    }
}

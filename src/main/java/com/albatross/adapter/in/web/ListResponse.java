package com.albatross.adapter.in.web;

import java.util.List;

/**
 * Envelope for list endpoints: {@code {"data": [...], "returned": n}}.
 */
public record ListResponse<T>(List<T> data, int returned) {

    public static <T> ListResponse<T> of(List<T> data) {
        return new ListResponse<>(data, data.size());
    }
}

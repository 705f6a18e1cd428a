package com.realgaming.marketplace.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PageResponse<T>(
        boolean success,
        List<T> data,
        Pagination pagination
) {
    public static <T> PageResponse<T> of(List<T> data, int page, int limit, long total) {
        long totalPages = (total + limit - 1) / limit;
        return new PageResponse<>(true, data, new Pagination(page, limit, total, totalPages));
    }

    public record Pagination(
            int page,
            int limit,
            long total,
            @JsonProperty("total_pages")
            long totalPages
    ) {}
}

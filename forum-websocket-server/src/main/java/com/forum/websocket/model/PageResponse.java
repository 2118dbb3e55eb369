package com.forum.websocket.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private List<T> data;
    private int page;
    private int limit;
    private long total;
    private int pages;

    public static <T> PageResponse<T> of(List<T> data, int page, int limit, long total) {
        int pages = limit > 0 ? (int) Math.ceil((double) total / limit) : 0;
        return new PageResponse<>(data, page, limit, total, pages);
    }
}

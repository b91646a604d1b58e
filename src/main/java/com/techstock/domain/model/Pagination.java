package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {

    private int page;
    private int size;
    private long total;
    private long totalPages;

    public static Pagination of(int page, int size, long total) {
        long totalPages = (total + size - 1) / size;
        return new Pagination(page, size, total, totalPages);
    }
}

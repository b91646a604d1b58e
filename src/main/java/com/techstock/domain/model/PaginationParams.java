package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 1-based page request.
 *
 * Getters never return invalid values: missing, zero or negative input is
 * replaced by the default and the size is clamped to [1, 100000].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationParams {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100_000;

    private Integer page;
    private Integer size;

    public static PaginationParams of(Integer page, Integer size) {
        return new PaginationParams(page, size);
    }

    public Integer getPage() {
        if (page == null) {
            return DEFAULT_PAGE;
        }
        return Math.max(page, DEFAULT_PAGE);
    }

    public Integer getSize() {
        if (size == null) {
            return DEFAULT_SIZE;
        }
        return Math.min(Math.max(size, 1), MAX_SIZE);
    }

    public long getOffset() {
        return (long) (getPage() - 1) * getSize();
    }
}

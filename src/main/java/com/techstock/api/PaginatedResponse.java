package com.techstock.api;

import com.techstock.domain.model.PagedResult;
import com.techstock.domain.model.Pagination;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResponse<T> {

    private List<T> data;
    private Pagination pagination;
    private boolean success;

    public static <T> PaginatedResponse<T> of(PagedResult<T> result) {
        return new PaginatedResponse<>(result.getItems(), result.getPagination(), true);
    }
}

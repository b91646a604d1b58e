package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SortParams {

    // Raw field name as sent by the caller; resolved by ResourceField.fromSortParameter
    private String field;
    private SortDirection direction;

    public SortDirection getDirection() {
        return direction == null ? SortDirection.ASC : direction;
    }
}

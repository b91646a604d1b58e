package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagIndex {

    private Map<String, Set<String>> tagValuesByKey;
    private List<TagUsage> popularTags;
}

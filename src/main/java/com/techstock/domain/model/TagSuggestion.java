package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagSuggestion {

    private String key;
    private String value;
    private String display;

    public static TagSuggestion of(String key, String value) {
        return new TagSuggestion(key, value, key + ":" + value);
    }
}

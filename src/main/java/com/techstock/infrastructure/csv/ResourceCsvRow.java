package com.techstock.infrastructure.csv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an Azure Resource Graph CSV export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceCsvRow {

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Type")
    private String type;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("Location")
    private String location;

    @JsonProperty("Subscription")
    private String subscription;

    @JsonProperty("Resource group")
    private String resourceGroup;

    // Raw JSON object text, or "null"
    @JsonProperty("Tags")
    private String tags;

    @JsonProperty("extendedLocation")
    private String extendedLocation;
}

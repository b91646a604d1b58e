package com.techstock.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceApplicationLinkId implements Serializable {

    private Long resourceId;
    private Long applicationId;
    private String relationType;
}

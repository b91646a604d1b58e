package com.techstock.domain.model;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateApplicationRequest {

    @Size(min = 1, message = "Code cannot be empty")
    private String code;

    private String name;
    private String ownerTeam;
    private String ownerEmail;
}

package com.techstock.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Application or service owning resources, usually derived from the
 * {@code AppID}/{@code AppName} tags.
 */
@Entity
@Table(name = "application")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true)
    private String code;

    private String name;

    @Column(name = "owner_team")
    private String ownerTeam;

    @Column(name = "owner_email")
    private String ownerEmail;
}

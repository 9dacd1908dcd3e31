package com.seshlog.ingest.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the log_user table.
 * Rows are created by the registration flow, never by ingestion.
 */
@Entity
@Table(name = "log_user")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "username", length = 150, nullable = false, unique = true)
    private String username;

    @ToString.Exclude
    @Column(name = "passkey", length = 150, nullable = false)
    private String passkey;

    @Column(name = "email", length = 150)
    private String email;
}

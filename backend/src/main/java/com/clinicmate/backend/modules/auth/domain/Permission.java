package com.clinicmate.backend.modules.auth.domain;

import com.clinicmate.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Permission code in {@code domain:resource:action} form, e.g. {@code patients:*:read}.
 * The code is the key and is never renamed once a role references it.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractAuditedEntity {

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = 100)
    private String code;

    @Column(name = "description", length = 255)
    private String description;

    protected Permission() {
    }

    public Permission(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}

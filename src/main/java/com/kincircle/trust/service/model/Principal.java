package com.kincircle.trust.service.model;

import java.util.Objects;

/** Caller identity handed over by the identity collaborator. */
public record Principal(String id, Role role) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }
}

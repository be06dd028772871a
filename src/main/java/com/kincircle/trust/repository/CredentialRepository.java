package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.Credential;

import java.util.Optional;

/** Persisted credential backend, one record per principal. */
public interface CredentialRepository {

    Optional<Credential> find(String principalId);

    void save(String principalId, Credential credential);

    /** @return {@code true} if a record existed */
    boolean delete(String principalId);
}

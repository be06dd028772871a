package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.Credential;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "memory")
public class InMemoryCredentialRepository implements CredentialRepository {

    private final Map<String, Credential> credentials = new ConcurrentHashMap<>();

    @Override
    public Optional<Credential> find(String principalId) {
        return Optional.ofNullable(credentials.get(principalId));
    }

    @Override
    public void save(String principalId, Credential credential) {
        credentials.put(principalId, credential);
    }

    @Override
    public boolean delete(String principalId) {
        return credentials.remove(principalId) != null;
    }
}

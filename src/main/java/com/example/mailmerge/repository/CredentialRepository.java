package com.example.mailmerge.repository;

import com.example.mailmerge.model.Credential;

import java.util.Optional;

public interface CredentialRepository {

    Optional<Credential> load();

    /** Replaces the stored credential atomically: readers see either the old or the new one. */
    void save(Credential credential);
}

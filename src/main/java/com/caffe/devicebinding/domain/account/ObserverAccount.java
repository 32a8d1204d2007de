package com.caffe.devicebinding.domain.account;

import java.util.Set;
import java.util.UUID;

/**
 * The parts of an observer account this service needs. Credentials stay with the
 * account directory.
 */
public class ObserverAccount {

    private final UUID id;
    private final String username;
    private final String email;
    private final String observerId;
    private final Set<String> roles;

    public ObserverAccount(UUID id, String username, String email, String observerId, Set<String> roles) {
        this.id = id;
        this.username = username;
        this.email = email;
        this.observerId = observerId;
        this.roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public UUID getId() { return id; }
    public String getUsername() { return username; }
    public String getEmail() { return email; }
    public String getObserverId() { return observerId; }
    public Set<String> getRoles() { return roles; }
}

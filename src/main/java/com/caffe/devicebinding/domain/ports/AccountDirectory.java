package com.caffe.devicebinding.domain.ports;

import com.caffe.devicebinding.domain.account.ObserverAccount;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to observer accounts and their credentials, which are owned elsewhere.
 */
public interface AccountDirectory {
    Optional<ObserverAccount> findByUsername(String username);
    Optional<ObserverAccount> findById(UUID accountId);

    /** Empty when the username is unknown or the password does not match. */
    Optional<ObserverAccount> authenticate(String username, String password);
}

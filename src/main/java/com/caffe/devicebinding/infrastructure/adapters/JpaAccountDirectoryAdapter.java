package com.caffe.devicebinding.infrastructure.adapters;

import com.caffe.devicebinding.domain.account.ObserverAccount;
import com.caffe.devicebinding.domain.ports.AccountDirectory;
import com.caffe.devicebinding.infrastructure.jpa.ObserverAccountEntity;
import com.caffe.devicebinding.infrastructure.jpa.SpringObserverAccountRepository;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaAccountDirectoryAdapter implements AccountDirectory {

    // spends comparable time on unknown usernames
    private static final String DUMMY_HASH = "$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z3ZQxL0fYd0p1Q9gk5rj3H2a";

    private final SpringObserverAccountRepository accounts;
    private final PasswordEncoder encoder;

    public JpaAccountDirectoryAdapter(SpringObserverAccountRepository accounts, PasswordEncoder encoder) {
        this.accounts = accounts;
        this.encoder = encoder;
    }

    @Override
    public Optional<ObserverAccount> findByUsername(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return accounts.findByUsername(username.trim().toLowerCase()).map(this::toDomain);
    }

    @Override
    public Optional<ObserverAccount> findById(UUID accountId) {
        return accounts.findById(accountId).map(this::toDomain);
    }

    @Override
    public Optional<ObserverAccount> authenticate(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        Optional<ObserverAccountEntity> account = accounts.findByUsername(username.trim().toLowerCase());
        if (account.isEmpty()) {
            encoder.matches(password, DUMMY_HASH);
            return Optional.empty();
        }
        if (!encoder.matches(password, account.get().getPasswordHash())) {
            return Optional.empty();
        }
        return account.map(this::toDomain);
    }

    private ObserverAccount toDomain(ObserverAccountEntity e) {
        return new ObserverAccount(e.getId(), e.getUsername(), e.getEmail(), e.getObserverId(), e.getRoles());
    }
}

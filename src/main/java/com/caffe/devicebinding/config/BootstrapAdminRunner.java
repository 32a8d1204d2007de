package com.caffe.devicebinding.config;

import com.caffe.devicebinding.infrastructure.jpa.ObserverAccountEntity;
import com.caffe.devicebinding.infrastructure.jpa.SpringObserverAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            SpringObserverAccountRepository accounts,
            PasswordEncoder encoder,
            @Value("${bootstrap.admin.username:}") String adminUsername,
            @Value("${bootstrap.admin.email:}") String adminEmail,
            @Value("${bootstrap.admin.password:}") String adminPassword,
            @Value("${bootstrap.admin.observer-id:ADMIN-0001}") String observerId
    ) {
        return args -> {
            if (adminUsername == null || adminUsername.isBlank() || adminPassword == null || adminPassword.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.username and bootstrap.admin.password");
                return;
            }

            if (accounts.existsByUsername(adminUsername.toLowerCase())) {
                log.info("Bootstrap admin exists: {}", adminUsername);
                return;
            }

            ObserverAccountEntity admin = new ObserverAccountEntity();
            admin.setId(UUID.randomUUID());
            admin.setUsername(adminUsername);
            admin.setEmail(adminEmail == null || adminEmail.isBlank() ? adminUsername + "@localhost" : adminEmail);
            admin.setObserverId(observerId);
            admin.setPasswordHash(encoder.encode(adminPassword));
            admin.setCreatedAt(OffsetDateTime.now());
            admin.setRoles(new HashSet<>(Set.of("ADMIN", "OBSERVER")));
            accounts.save(admin);

            log.info("Bootstrap admin created: {} (observerId={})", adminUsername, observerId);
        };
    }
}

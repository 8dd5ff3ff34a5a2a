package com.example.securitycore.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Accounts that may open sessions, bound from {@code security.identities.*}.
 * Password hashes use the {@code pbkdf2-sha256$<iterations>$<salt>$<hash>} form produced
 * by {@code CredentialVerifier.hashPassword}.
 */
@Component
@ConfigurationProperties(prefix = "security.identities")
@Data
public class IdentityProperties {

    private List<Account> accounts = new ArrayList<>();

    @Data
    public static class Account {
        private String tenantId;
        private String userId;
        private String passwordHash;
        private List<String> roles = new ArrayList<>();
    }
}

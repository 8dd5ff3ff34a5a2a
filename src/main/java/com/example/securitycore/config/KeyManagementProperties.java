package com.example.securitycore.config;

import com.example.securitycore.models.EncryptionKey;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Key management settings bound from {@code security.keys.*}.
 */
@Component
@ConfigurationProperties(prefix = "security.keys")
@Data
public class KeyManagementProperties {

    /** Base64 encoded 256-bit key-encryption key that wraps all stored key material. */
    private String masterKey;

    /** Generate version 1 of a DATA scope the first time a field is encrypted under it. */
    private boolean autoProvision = true;

    private Rotation rotation = new Rotation();

    public Duration rotationPeriod(EncryptionKey.KeyType type) {
        Duration configured = switch (type) {
            case MASTER -> rotation.getMaster();
            case DATA -> rotation.getData();
            case SESSION -> rotation.getSession();
            case API -> rotation.getApi();
        };
        return configured != null ? configured : type.getDefaultRotationPeriod();
    }

    @Data
    public static class Rotation {
        private boolean enabled = false;
        private String schedule = "0 0 3 * * *";
        private Duration master = EncryptionKey.KeyType.MASTER.getDefaultRotationPeriod();
        private Duration data = EncryptionKey.KeyType.DATA.getDefaultRotationPeriod();
        private Duration session = EncryptionKey.KeyType.SESSION.getDefaultRotationPeriod();
        private Duration api = EncryptionKey.KeyType.API.getDefaultRotationPeriod();
        // deprecated keys stay usable for decryption this long before being revoked
        private Duration deprecatedGracePeriod = Duration.ofDays(30);
    }
}

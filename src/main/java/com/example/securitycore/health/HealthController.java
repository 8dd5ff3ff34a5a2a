package com.example.securitycore.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final String env;
    private final String storageBackend;
    private final Clock clock;

    public HealthController(@Value("${app.env:local}") String env,
                            @Value("${storage.backend:dynamo}") String storageBackend,
                            ObjectProvider<BuildProperties> buildProperties,
                            Clock clock) {
        this.env = env;
        this.storageBackend = storageBackend;
        this.buildProperties = buildProperties.getIfAvailable();
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now(clock).toString(),
                "env", env,
                "storage", storageBackend,
                "app", buildProperties != null ? buildProperties.getName() : "security-core",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev"
        ));
    }
}

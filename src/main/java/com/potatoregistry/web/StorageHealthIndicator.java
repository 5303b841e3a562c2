package com.potatoregistry.web;

import com.potatoregistry.config.RegistryProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component("storage")
public class StorageHealthIndicator implements HealthIndicator {

    private final Path root;

    public StorageHealthIndicator(RegistryProperties props) {
        this.root = props.storage().path().toAbsolutePath();
    }

    @Override
    public Health health() {
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return Health.down().withDetail("path", root.toString()).withDetail("reason", "not a writable directory").build();
        }
        try {
            return Health.up()
                    .withDetail("path", root.toString())
                    .withDetail("usableBytes", Files.getFileStore(root).getUsableSpace())
                    .build();
        } catch (IOException e) {
            return Health.down(e).withDetail("path", root.toString()).build();
        }
    }
}

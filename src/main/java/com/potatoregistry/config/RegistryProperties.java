package com.potatoregistry.config;

import com.potatoregistry.storage.HashAlgo;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
        @DefaultValue Storage storage,
        @DefaultValue Upload upload,
        @DefaultValue Catalog catalog,
        @DefaultValue Reconcile reconcile,
        @DefaultValue Gc gc,
        @DefaultValue Retrieval retrieval
) {

    public record Storage(
            @DefaultValue("./storage") Path path,
            @DefaultValue("SHA-256") String hashAlgo
    ) {
        public HashAlgo algo() { return HashAlgo.of(hashAlgo); }
    }

    public record Upload(
            @DefaultValue("1GB") DataSize maxSize,
            @DefaultValue Retry retry
    ) {}

    public record Retry(
            @DefaultValue("4") int maxAttempts,
            @DefaultValue("50ms") Duration initialBackoff,
            @DefaultValue("2s") Duration maxBackoff
    ) {}

    public record Catalog(
            @DefaultValue("true") boolean reuseDeletedVersions
    ) {}

    public record Reconcile(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("15m") Duration pendingTimeout,
            @DefaultValue("1m") Duration interval
    ) {}

    public record Gc(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("1h") Duration gracePeriod,
            @DefaultValue("7d") Duration deletedRetention,
            @DefaultValue("10m") Duration interval
    ) {}

    public record Retrieval(
            @DefaultValue("64MB") DataSize verifyBeforeServeMaxSize
    ) {}

    /** Defaults for code that builds the registry outside a Spring context (tests, tools). */
    public static RegistryProperties defaults(Path storagePath) {
        return new RegistryProperties(
                new Storage(storagePath, "SHA-256"),
                new Upload(DataSize.ofGigabytes(1),
                        new Retry(4, Duration.ofMillis(50), Duration.ofSeconds(2))),
                new Catalog(true),
                new Reconcile(true, Duration.ofMinutes(15), Duration.ofMinutes(1)),
                new Gc(true, Duration.ofHours(1), Duration.ofDays(7), Duration.ofMinutes(10)),
                new Retrieval(DataSize.ofMegabytes(64)));
    }
}

package com.potatoregistry.catalog;

import com.potatoregistry.version.Version;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide cache of published versions per package, newest first.
 *
 * <p>Filled once by {@link #initialize} before the server takes traffic, afterwards loaded lazily
 * per name. The catalog calls {@link #invalidate} after every mutation touching a package. Names
 * with no published version are never cached.
 */
@Slf4j
@Component
public class PublishedVersionIndex {

    private final ConcurrentHashMap<String, List<Version>> byName = new ConcurrentHashMap<>();

    public void initialize(Map<String, List<Version>> published) {
        // entries loaded since the snapshot was taken are newer than it
        published.forEach((name, versions) -> {
            if (!versions.isEmpty()) byName.putIfAbsent(name, sorted(versions));
        });
        log.info("published version index initialized with {} package(s)", byName.size());
    }

    public List<Version> versions(String name, Function<String, List<Version>> loader) {
        List<Version> cached = byName.compute(name, (n, current) -> {
            if (current != null) return current;
            List<Version> loaded = sorted(loader.apply(n));
            return loaded.isEmpty() ? null : loaded;
        });
        return cached == null ? List.of() : cached;
    }

    int size() { return byName.size(); }

    public void invalidate(String name) { byName.remove(name); }

    private static List<Version> sorted(List<Version> versions) {
        return versions.stream().sorted(Comparator.reverseOrder()).toList();
    }
}

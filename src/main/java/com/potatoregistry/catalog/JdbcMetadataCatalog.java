package com.potatoregistry.catalog;

import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.ConflictException;
import com.potatoregistry.error.InvalidStateException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.error.TransientStorageException;
import com.potatoregistry.version.Version;
import com.potatoregistry.version.VersionRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link MetadataCatalog} over a single {@code catalog_entries} table (see {@code schema.sql}).
 *
 * <p>Slot ownership is decided by the {@code UNIQUE (name, version)} constraint: a reservation
 * inserts optimistically and, on a duplicate key, re-reads the row and decides again. State
 * transitions are conditional updates ({@code ... WHERE state = 'PENDING'}), so two workers racing
 * on the same entry cannot both succeed. Statements run in auto-commit mode; none of the
 * operations needs more than one row-level write.
 */
@Slf4j
@Repository
public class JdbcMetadataCatalog implements MetadataCatalog {

    private static final int MAX_RESERVE_ATTEMPTS = 5;

    private static final String COLUMNS =
            "id, name, version, content_hash, size_bytes, state, uploaded_at_ms, state_changed_at_ms, deleted_reason, download_count";

    private static final RowMapper<CatalogEntry> ENTRY = (rs, i) -> new CatalogEntry(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("version"),
            rs.getString("content_hash"),
            rs.getLong("size_bytes"),
            EntryState.valueOf(rs.getString("state")),
            Instant.ofEpochMilli(rs.getLong("uploaded_at_ms")),
            Instant.ofEpochMilli(rs.getLong("state_changed_at_ms")),
            rs.getString("deleted_reason"),
            rs.getLong("download_count"));

    private final NamedParameterJdbcTemplate jdbc;
    private final PublishedVersionIndex index;
    private final Clock clock;
    private final boolean reuseDeletedVersions;

    @Autowired
    public JdbcMetadataCatalog(NamedParameterJdbcTemplate jdbc, PublishedVersionIndex index, Clock clock,
                               RegistryProperties props) {
        this(jdbc, index, clock, props.catalog().reuseDeletedVersions());
    }

    public JdbcMetadataCatalog(NamedParameterJdbcTemplate jdbc, PublishedVersionIndex index, Clock clock,
                               boolean reuseDeletedVersions) {
        this.jdbc = jdbc;
        this.index = index;
        this.clock = clock;
        this.reuseDeletedVersions = reuseDeletedVersions;
    }

    // ====== Publish protocol ======

    @Override
    public Reservation beginPublish(String name, String version, long expectedSize, String expectedHash) {
        String n = PackageNames.normalize(name);
        requireVersion(version);
        if (expectedSize < 0) throw new IllegalArgumentException("size must be >= 0");
        return translate(() -> {
            for (int attempt = 0; attempt < MAX_RESERVE_ATTEMPTS; attempt++) {
                Optional<CatalogEntry> existing = findBySlot(n, version);
                if (existing.isEmpty()) {
                    try {
                        long id = insertPending(n, version, expectedSize, expectedHash);
                        log.debug("reserved {} {} as entry {}", n, version, id);
                        return new Reservation(id, EntryState.PENDING, true);
                    } catch (DuplicateKeyException raced) {
                        log.debug("lost insert race for {} {}, re-reading", n, version);
                        continue;
                    }
                }

                CatalogEntry e = existing.get();
                if (e.state() == EntryState.DELETED) {
                    if (!reuseDeletedVersions) {
                        throw new ConflictException(n + " " + version + " was deleted and cannot be republished until purged");
                    }
                    if (reuseDeleted(e.id(), expectedSize, expectedHash)) {
                        index.invalidate(n);
                        log.info("reusing deleted slot {} {} (entry {})", n, version, e.id());
                        return new Reservation(e.id(), EntryState.PENDING, true);
                    }
                    continue;
                }
                if (!e.contentHash().equalsIgnoreCase(expectedHash)) {
                    throw new ConflictException(n + " " + version + " is already " + e.state().name().toLowerCase(Locale.ROOT)
                            + " with different content");
                }
                return new Reservation(e.id(), e.state(), false);
            }
            throw new TransientStorageException("could not reserve " + n + " " + version + " after "
                    + MAX_RESERVE_ATTEMPTS + " attempts");
        });
    }

    @Override
    public CatalogEntry commitPublish(long entryId) {
        return translate(() -> {
            int rows = jdbc.update(
                    "UPDATE catalog_entries SET state = 'PUBLISHED', state_changed_at_ms = :now"
                            + " WHERE id = :id AND state = 'PENDING'",
                    params().addValue("id", entryId).addValue("now", now()));
            CatalogEntry e = findById(entryId)
                    .orElseThrow(() -> new NotFoundException("entry " + entryId + " not found (aborted?)"));
            if (rows == 0) {
                throw new InvalidStateException("entry " + entryId + " is " + e.state() + ", expected PENDING");
            }
            index.invalidate(e.name());
            return e;
        });
    }

    @Override
    public void abortPublish(long entryId) {
        translate(() -> {
            CatalogEntry e = findById(entryId)
                    .orElseThrow(() -> new NotFoundException("entry " + entryId + " not found"));
            int rows = jdbc.update("DELETE FROM catalog_entries WHERE id = :id AND state = 'PENDING'",
                    params().addValue("id", entryId));
            if (rows == 0) {
                CatalogEntry now = findById(entryId)
                        .orElseThrow(() -> new NotFoundException("entry " + entryId + " not found"));
                throw new InvalidStateException("entry " + entryId + " is " + now.state() + ", expected PENDING");
            }
            index.invalidate(e.name());
            return null;
        });
    }

    // ====== Lookups ======

    @Override
    public CatalogEntry resolve(String name, String versionOrRange) {
        String n = PackageNames.normalize(name);
        VersionRange range = VersionRange.parse(versionOrRange);
        return translate(() -> {
            if (range.isExact()) {
                return findPublished(n, range.exactVersion().toString())
                        .orElseThrow(() -> new NotFoundException(n + " " + versionOrRange + " not found"));
            }
            // one retry covers a version deleted between index read and row read
            for (int attempt = 0; attempt < 2; attempt++) {
                Version selected = range.selectFrom(index.versions(n, this::loadPublishedVersions))
                        .orElseThrow(() -> new NotFoundException("no version of " + n + " matches " + versionOrRange));
                Optional<CatalogEntry> e = findPublished(n, selected.toString());
                if (e.isPresent()) return e.get();
                index.invalidate(n);
            }
            throw new NotFoundException("no version of " + n + " matches " + versionOrRange);
        });
    }

    @Override
    public CatalogEntry softDelete(String name, String version, String reason) {
        String n = PackageNames.normalize(name);
        return translate(() -> {
            int rows = jdbc.update(
                    "UPDATE catalog_entries SET state = 'DELETED', state_changed_at_ms = :now, deleted_reason = :reason"
                            + " WHERE name = :name AND version = :version AND state = 'PUBLISHED'",
                    params().addValue("now", now()).addValue("reason", truncate(reason))
                            .addValue("name", n).addValue("version", version));
            if (rows == 0) throw new NotFoundException(n + " " + version + " not found");
            index.invalidate(n);
            log.info("deleted {} {}{}", n, version, reason == null ? "" : " (" + reason + ")");
            return findBySlot(n, version).orElseThrow(() -> new NotFoundException(n + " " + version + " not found"));
        });
    }

    @Override
    public int softDeletePackage(String name, String reason) {
        String n = PackageNames.normalize(name);
        return translate(() -> {
            int rows = jdbc.update(
                    "UPDATE catalog_entries SET state = 'DELETED', state_changed_at_ms = :now, deleted_reason = :reason"
                            + " WHERE name = :name AND state = 'PUBLISHED'",
                    params().addValue("now", now()).addValue("reason", truncate(reason)).addValue("name", n));
            if (rows == 0) throw new NotFoundException("package " + n + " not found");
            index.invalidate(n);
            log.info("deleted package {} ({} version(s)){}", n, rows, reason == null ? "" : " (" + reason + ")");
            return rows;
        });
    }

    @Override
    public Set<String> listReferencedHashes() {
        return translate(() -> new HashSet<>(jdbc.queryForList(
                "SELECT DISTINCT content_hash FROM catalog_entries", params(), String.class)));
    }

    @Override
    public boolean isReferenced(String contentHash) {
        return translate(() -> {
            Integer count = jdbc.queryForObject(
                    "SELECT COUNT(*) FROM catalog_entries WHERE content_hash = :hash",
                    params().addValue("hash", contentHash), Integer.class);
            return count != null && count > 0;
        });
    }

    @Override
    public List<String> listVersions(String name) {
        String n = PackageNames.normalize(name);
        return translate(() -> index.versions(n, this::loadPublishedVersions).stream().map(Version::toString).toList());
    }

    @Override
    public List<String> listPackageNames() {
        return translate(() -> jdbc.queryForList(
                "SELECT DISTINCT name FROM catalog_entries WHERE state = 'PUBLISHED' ORDER BY name",
                params(), String.class));
    }

    @Override
    public List<CatalogEntry> describe(String name) {
        String n = PackageNames.normalize(name);
        return translate(() -> {
            List<CatalogEntry> entries = new ArrayList<>(jdbc.query(
                    "SELECT " + COLUMNS + " FROM catalog_entries WHERE name = :name AND state <> 'PENDING'",
                    params().addValue("name", n), ENTRY));
            entries.sort(Comparator.comparing((CatalogEntry e) -> Version.parse(e.version())).reversed());
            return entries;
        });
    }

    @Override
    public Optional<CatalogEntry> findById(long entryId) {
        return translate(() -> jdbc.query(
                "SELECT " + COLUMNS + " FROM catalog_entries WHERE id = :id",
                params().addValue("id", entryId), ENTRY).stream().findFirst());
    }

    // ====== Maintenance ======

    @Override
    public List<CatalogEntry> findStalePending(Instant olderThan) {
        return translate(() -> jdbc.query(
                "SELECT " + COLUMNS + " FROM catalog_entries WHERE state = 'PENDING' AND state_changed_at_ms < :t"
                        + " ORDER BY state_changed_at_ms",
                params().addValue("t", olderThan.toEpochMilli()), ENTRY));
    }

    @Override
    public int purgeDeleted(Instant olderThan) {
        return translate(() -> {
            MapSqlParameterSource p = params().addValue("t", olderThan.toEpochMilli());
            List<String> names = jdbc.queryForList(
                    "SELECT DISTINCT name FROM catalog_entries WHERE state = 'DELETED' AND state_changed_at_ms < :t",
                    p, String.class);
            int rows = jdbc.update(
                    "DELETE FROM catalog_entries WHERE state = 'DELETED' AND state_changed_at_ms < :t", p);
            names.forEach(index::invalidate);
            return rows;
        });
    }

    @Override
    public void recordDownload(long entryId) {
        translate(() -> jdbc.update(
                "UPDATE catalog_entries SET download_count = download_count + 1 WHERE id = :id",
                params().addValue("id", entryId)));
    }

    @Override
    public void initializeIndex() {
        translate(() -> {
            Map<String, List<Version>> published = new HashMap<>();
            jdbc.query("SELECT name, version FROM catalog_entries WHERE state = 'PUBLISHED'", params(), rs -> {
                published.computeIfAbsent(rs.getString("name"), k -> new ArrayList<>())
                        .add(Version.parse(rs.getString("version")));
            });
            index.initialize(published);
            return null;
        });
    }

    // ====== Helpers ======

    private long insertPending(String name, String version, long size, String hash) {
        long now = now();
        jdbc.update("INSERT INTO catalog_entries"
                        + " (name, version, content_hash, size_bytes, state, uploaded_at_ms, state_changed_at_ms, download_count)"
                        + " VALUES (:name, :version, :hash, :size, 'PENDING', :now, :now, 0)",
                params().addValue("name", name).addValue("version", version)
                        .addValue("hash", hash).addValue("size", size).addValue("now", now));
        Long id = jdbc.queryForObject(
                "SELECT id FROM catalog_entries WHERE name = :name AND version = :version",
                params().addValue("name", name).addValue("version", version), Long.class);
        if (id == null) throw new IllegalStateException("inserted row vanished: " + name + " " + version);
        return id;
    }

    private boolean reuseDeleted(long id, long size, String hash) {
        long now = now();
        return jdbc.update("UPDATE catalog_entries SET state = 'PENDING', content_hash = :hash, size_bytes = :size,"
                        + " uploaded_at_ms = :now, state_changed_at_ms = :now, deleted_reason = NULL, download_count = 0"
                        + " WHERE id = :id AND state = 'DELETED'",
                params().addValue("hash", hash).addValue("size", size).addValue("now", now).addValue("id", id)) == 1;
    }

    private Optional<CatalogEntry> findBySlot(String name, String version) {
        return jdbc.query("SELECT " + COLUMNS + " FROM catalog_entries WHERE name = :name AND version = :version",
                params().addValue("name", name).addValue("version", version), ENTRY).stream().findFirst();
    }

    private Optional<CatalogEntry> findPublished(String name, String version) {
        return findBySlot(name, version).filter(e -> e.state() == EntryState.PUBLISHED);
    }

    private List<Version> loadPublishedVersions(String name) {
        return jdbc.queryForList(
                        "SELECT version FROM catalog_entries WHERE name = :name AND state = 'PUBLISHED'",
                        params().addValue("name", name), String.class)
                .stream().map(Version::parse).toList();
    }

    private long now() { return clock.millis(); }

    private static MapSqlParameterSource params() { return new MapSqlParameterSource(); }

    private static void requireVersion(String version) {
        if (!Version.isValid(version)) throw new IllegalArgumentException("invalid version: " + version);
    }

    private static String truncate(String reason) {
        if (reason == null || reason.isBlank()) return null;
        return reason.length() > 255 ? reason.substring(0, 255) : reason;
    }

    /** Connection loss, lock timeouts and similar database hiccups become retryable storage errors. */
    private static <T> T translate(Supplier<T> op) {
        try {
            return op.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            throw new TransientStorageException("catalog unavailable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}

package com.glyphvault.core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glyphvault.core.error.GlyphNotFoundException;
import com.glyphvault.core.error.GlyphVaultException;
import com.glyphvault.core.glyph.Glyph;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable, append-only record of glyphs and every action taken on them.
 *
 * Two tables: {@code glyphs} (one summary row per id) and {@code audit_log}
 * (insert-only, references {@code glyphs}). A glyph row and its
 * {@code CREATED} entry are always written in the same transaction. No
 * operation updates or deletes rows.
 */
public class AuditLedger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    public static final int MAX_LIST_LIMIT = 1000;

    private static final String MIGRATIONS = "classpath:db/ledger";
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String INSERT_GLYPH = """
            INSERT INTO glyphs (glyph_id, data_hash, source, timestamp, signer, signature, verified)
            VALUES (:glyphId, :dataHash, :source, :timestamp, :signer, :signature, :verified)
            """;

    private static final String INSERT_AUDIT = """
            INSERT INTO audit_log (glyph_id, action, actor, timestamp, metadata)
            VALUES (:glyphId, :action, :actor, :timestamp, :metadata)
            """;

    private static final String SELECT_GLYPH_COLUMNS =
            "SELECT glyph_id, data_hash, source, timestamp, signer, signature, verified FROM glyphs";

    private final DataSource dataSource;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final RowMapper<GlyphSummary> summaryMapper = (rs, rowNum) -> new GlyphSummary(
            rs.getString("glyph_id"),
            rs.getString("data_hash"),
            rs.getString("source"),
            rs.getLong("timestamp"),
            rs.getString("signer"),
            rs.getString("signature"),
            rs.getBoolean("verified"));

    private final RowMapper<AuditEntry> entryMapper = (rs, rowNum) -> new AuditEntry(
            rs.getLong("id"),
            rs.getString("glyph_id"),
            rs.getString("action"),
            rs.getString("actor"),
            rs.getLong("timestamp"),
            readMetadata(rs.getString("metadata")));

    public AuditLedger(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    /**
     * Wraps a data source and brings its schema up to date.
     */
    public AuditLedger(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.mapper = new ObjectMapper();
        migrate(dataSource);
    }

    /**
     * Opens a file-backed ledger at {@code databaseFile} (H2 appends its own
     * extension).
     */
    public static AuditLedger open(Path databaseFile) {
        return open(databaseFile, Clock.systemUTC());
    }

    public static AuditLedger open(Path databaseFile, Clock clock) {
        Objects.requireNonNull(databaseFile, "Ledger path cannot be null");
        return new AuditLedger(pool("jdbc:h2:file:" + databaseFile.toAbsolutePath()), clock);
    }

    /**
     * Non-durable ledger living as long as the returned instance.
     */
    public static AuditLedger inMemory(String name, Clock clock) {
        return new AuditLedger(pool("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1"), clock);
    }

    /**
     * Inserts the glyph summary and its {@code CREATED} entry atomically.
     *
     * @return {@code false} if the id was already recorded; nothing is written then
     */
    public boolean recordGlyph(Glyph glyph) {
        Objects.requireNonNull(glyph, "Glyph cannot be null");
        try {
            return inTransaction(() -> {
                if (contains(glyph.id())) {
                    return false;
                }
                jdbcTemplate.update(INSERT_GLYPH, new MapSqlParameterSource()
                        .addValue("glyphId", glyph.id())
                        .addValue("dataHash", glyph.dataHash())
                        .addValue("source", glyph.source())
                        .addValue("timestamp", glyph.timestamp())
                        .addValue("signer", glyph.signer())
                        .addValue("signature", glyph.signature())
                        .addValue("verified", glyph.verified()));
                insertEntry(glyph.id(), AuditEntry.CREATED, glyph.signer(), Map.of("source", glyph.source()));
                return true;
            });
        } catch (DuplicateKeyException e) {
            log.debug("Glyph {} was recorded concurrently", glyph.id());
            return false;
        }
    }

    /**
     * Appends an action to a glyph's audit trail.
     *
     * @throws GlyphNotFoundException if the glyph was never recorded
     */
    public AuditEntry logAction(String glyphId, String action, String actor, Map<String, Object> metadata) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action cannot be null or blank");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor cannot be null or blank");
        }
        return inTransaction(() -> {
            if (!contains(glyphId)) {
                throw new GlyphNotFoundException(glyphId);
            }
            return insertEntry(glyphId, action, actor, metadata != null ? metadata : Map.of());
        });
    }

    public Optional<GlyphSummary> getGlyph(String glyphId) {
        List<GlyphSummary> rows = jdbcTemplate.query(
                SELECT_GLYPH_COLUMNS + " WHERE glyph_id = :glyphId",
                new MapSqlParameterSource("glyphId", glyphId),
                summaryMapper);
        return rows.stream().findFirst();
    }

    public boolean contains(String glyphId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM glyphs WHERE glyph_id = :glyphId",
                new MapSqlParameterSource("glyphId", glyphId),
                Integer.class);
        return count != null && count > 0;
    }

    /**
     * Audit entries for a glyph, oldest first.
     */
    public List<AuditEntry> getAuditTrail(String glyphId) {
        return jdbcTemplate.query(
                "SELECT id, glyph_id, action, actor, timestamp, metadata FROM audit_log "
                        + "WHERE glyph_id = :glyphId ORDER BY id ASC",
                new MapSqlParameterSource("glyphId", glyphId),
                entryMapper);
    }

    public List<GlyphSummary> list(String source, int limit) {
        return list(source, limit, 0);
    }

    /**
     * Glyph summaries, newest first.
     *
     * @param source optional exact-match source filter
     * @param limit  page size, 1 to {@value #MAX_LIST_LIMIT}
     * @param offset rows to skip
     */
    public List<GlyphSummary> list(String source, int limit, int offset) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("offset", offset);
        StringBuilder sql = new StringBuilder(SELECT_GLYPH_COLUMNS);
        if (source != null) {
            sql.append(" WHERE source = :source");
            params.addValue("source", source);
        }
        sql.append(" ORDER BY timestamp DESC, glyph_id ASC LIMIT :limit OFFSET :offset");
        return jdbcTemplate.query(sql.toString(), params, summaryMapper);
    }

    public VaultStats stats() {
        Map<String, Long> sources = new HashMap<>();
        jdbcTemplate.query("SELECT source, COUNT(*) AS glyph_count FROM glyphs GROUP BY source",
                (RowCallbackHandler) rs -> sources.put(rs.getString("source"), rs.getLong("glyph_count")));
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS total, "
                        + "COALESCE(SUM(CASE WHEN verified THEN 1 ELSE 0 END), 0) AS verified_count, "
                        + "COALESCE(MAX(timestamp), 0) AS latest FROM glyphs",
                new MapSqlParameterSource(),
                (rs, rowNum) -> new VaultStats(
                        rs.getLong("total"),
                        rs.getLong("verified_count"),
                        sources,
                        rs.getLong("latest")));
    }

    /**
     * Runs {@code work} in a ledger transaction, joining one already in
     * progress. Any exception rolls the transaction back and propagates.
     */
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource pool) {
            pool.close();
        }
    }

    // ==================== Private Methods ====================

    private AuditEntry insertEntry(String glyphId, String action, String actor, Map<String, Object> metadata) {
        long timestamp = clock.instant().getEpochSecond();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(INSERT_AUDIT, new MapSqlParameterSource()
                .addValue("glyphId", glyphId)
                .addValue("action", action)
                .addValue("actor", actor)
                .addValue("timestamp", timestamp)
                .addValue("metadata", writeMetadata(metadata)), keyHolder);
        Number sequence = keyHolder.getKey();
        log.debug("Audit {} on {} by {}", action, glyphId, actor);
        return new AuditEntry(sequence != null ? sequence.longValue() : 0L, glyphId, action, actor, timestamp, metadata);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new GlyphVaultException("Audit metadata is corrupt: " + json, e);
        }
    }

    private static void migrate(DataSource dataSource) {
        Flyway.configure()
                .dataSource(dataSource)
                .locations(MIGRATIONS)
                .table("ledger_schema_history")
                .load()
                .migrate();
    }

    private static HikariDataSource pool(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername("sa");
        config.setPassword("");
        config.setPoolName("glyph-ledger");
        config.setMaximumPoolSize(4);
        config.setAutoCommit(true);
        return new HikariDataSource(config);
    }
}

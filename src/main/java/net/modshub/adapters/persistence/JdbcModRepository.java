package net.modshub.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import net.modshub.domain.Mod;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;
import net.modshub.repository.ModRepository;
import net.modshub.support.retry.StoreRetrySupport;
import net.modshub.support.retry.StoreRetrySupport.RetryConfig;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for the {@code mods} table.
 *
 * <p>Owns all SQL for mod records; slug uniqueness is enforced by the slug index,
 * not by a constraint here.</p>
 */
public class JdbcModRepository implements ModRepository {

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT mod_id, slug, title, description, category, tags, visibility, status,
               owner_id, featured, created_at, updated_at, version
        FROM mods
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RetryConfig retryConfig;
    private final RowMapper<Mod> rowMapper = this::mapRow;

    public JdbcModRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, RetryConfig retryConfig) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.retryConfig = retryConfig;
    }

    @Override
    public Optional<Mod> findById(String modId) {
        if (modId == null) {
            throw new IllegalArgumentException("modId is required");
        }
        return StoreRetrySupport.execute(retryConfig, "mods findById", () ->
            jdbcTemplate.query(SELECT_COLUMNS + "WHERE mod_id = ?", rowMapper, modId)
                .stream()
                .findFirst());
    }

    @Override
    public void insert(Mod mod) {
        String tagsJson = serializeTags(mod.getTags());
        StoreRetrySupport.run(retryConfig, "mods insert", () -> jdbcTemplate.update(
            """
            INSERT INTO mods (mod_id, slug, title, description, category, tags, visibility, status,
                              owner_id, featured, created_at, updated_at, version)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
            """,
            mod.getModId(),
            mod.getSlug(),
            mod.getTitle(),
            mod.getDescription(),
            mod.getCategory().wireValue(),
            tagsJson,
            mod.getVisibility().wireValue(),
            mod.getStatus().wireValue(),
            mod.getOwnerId(),
            mod.isFeatured(),
            Timestamp.from(mod.getCreatedAt()),
            Timestamp.from(mod.getUpdatedAt()),
            mod.getVersion()
        ));
    }

    /**
     * Compare-and-set on {@code version}; owner and creation time are never rewritten.
     */
    @Override
    public boolean replace(Mod expected, Mod updated) {
        if (!expected.getModId().equals(updated.getModId()) || updated.getVersion() != expected.getVersion() + 1) {
            throw new IllegalArgumentException("Replacement of " + expected.getModId() + " must carry the next version");
        }
        String tagsJson = serializeTags(updated.getTags());
        return StoreRetrySupport.execute(retryConfig, "mods replace", () -> jdbcTemplate.update(
            """
            UPDATE mods SET
                slug = ?,
                title = ?,
                description = ?,
                category = ?,
                tags = ?::jsonb,
                visibility = ?,
                status = ?,
                featured = ?,
                updated_at = ?,
                version = ?
            WHERE mod_id = ? AND version = ?
            """,
            updated.getSlug(),
            updated.getTitle(),
            updated.getDescription(),
            updated.getCategory().wireValue(),
            tagsJson,
            updated.getVisibility().wireValue(),
            updated.getStatus().wireValue(),
            updated.isFeatured(),
            Timestamp.from(updated.getUpdatedAt()),
            updated.getVersion(),
            expected.getModId(),
            expected.getVersion()
        ) == 1);
    }

    @Override
    public boolean deleteById(String modId) {
        return StoreRetrySupport.execute(retryConfig, "mods deleteById",
            () -> jdbcTemplate.update("DELETE FROM mods WHERE mod_id = ?", modId) > 0);
    }

    @Override
    public List<Mod> findAll() {
        return StoreRetrySupport.execute(retryConfig, "mods findAll",
            () -> jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY created_at DESC", rowMapper));
    }

    private Mod mapRow(ResultSet rs, int rowNum) throws SQLException {
        String modId = rs.getString("mod_id");
        return Mod.builder()
            .modId(modId)
            .slug(rs.getString("slug"))
            .title(rs.getString("title"))
            .description(rs.getString("description"))
            .category(parseColumn(ModCategory.fromWireValue(rs.getString("category")), "category", modId))
            .tags(deserializeTags(rs.getString("tags"), modId))
            .visibility(parseColumn(ModVisibility.fromWireValue(rs.getString("visibility")), "visibility", modId))
            .status(parseColumn(ModStatus.fromWireValue(rs.getString("status")), "status", modId))
            .ownerId(rs.getString("owner_id"))
            .featured(rs.getBoolean("featured"))
            .createdAt(requireTimestamp(rs.getTimestamp("created_at"), "created_at", modId).toInstant())
            .updatedAt(requireTimestamp(rs.getTimestamp("updated_at"), "updated_at", modId).toInstant())
            .version(rs.getLong("version"))
            .build();
    }

    private static <T> T parseColumn(Optional<T> parsed, String column, String modId) {
        return parsed.orElseThrow(() ->
            new IllegalStateException("Persisted mod " + modId + " has unrecognized " + column));
    }

    private static Timestamp requireTimestamp(Timestamp value, String column, String modId) {
        if (value == null) {
            throw new IllegalStateException("Persisted mod " + modId + " missing " + column);
        }
        return value;
    }

    private String serializeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags == null ? List.of() : tags);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize mod tags", e);
        }
    }

    private List<String> deserializeTags(String json, String modId) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(objectMapper.readValue(json, TAG_LIST));
        } catch (JacksonException e) {
            throw new IllegalStateException("Persisted mod " + modId + " has unreadable tags", e);
        }
    }
}

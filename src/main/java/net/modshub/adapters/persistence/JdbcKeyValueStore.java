package net.modshub.adapters.persistence;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import net.modshub.repository.KeyValueStore;
import net.modshub.support.retry.StoreRetrySupport;
import net.modshub.support.retry.StoreRetrySupport.RetryConfig;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Postgres adapter for one namespace of the {@code mod_index_entries} table.
 *
 * <p>Conditional writes are single statements ({@code ON CONFLICT DO NOTHING},
 * {@code DELETE ... WHERE entry_value = ?}), so the primary key on
 * {@code (namespace, entry_key)} is the only concurrency control.</p>
 */
public class JdbcKeyValueStore implements KeyValueStore {

    private static final int MAX_CLAIM_ROUNDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final String namespace;
    private final RetryConfig retryConfig;

    public JdbcKeyValueStore(JdbcTemplate jdbcTemplate, String namespace, RetryConfig retryConfig) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
    }

    @Override
    public Optional<String> get(String key) {
        return StoreRetrySupport.execute(retryConfig, namespace + " get", () -> selectValue(key));
    }

    @Override
    public Optional<String> putIfAbsent(String key, String value) {
        return StoreRetrySupport.execute(retryConfig, namespace + " putIfAbsent", () -> {
            // The holder can vanish between a lost insert and the read-back; claim again.
            for (int round = 1; round <= MAX_CLAIM_ROUNDS; round++) {
                int inserted = jdbcTemplate.update(
                    """
                    INSERT INTO mod_index_entries (namespace, entry_key, entry_value)
                    VALUES (?, ?, ?)
                    ON CONFLICT (namespace, entry_key) DO NOTHING
                    """,
                    namespace, key, value
                );
                if (inserted == 1) {
                    return Optional.<String>empty();
                }
                Optional<String> holder = selectValue(key);
                if (holder.isPresent()) {
                    return holder;
                }
            }
            throw new ConcurrencyFailureException(
                "Key '" + key + "' in namespace " + namespace + " kept changing hands during claim");
        });
    }

    @Override
    public void put(String key, String value) {
        StoreRetrySupport.run(retryConfig, namespace + " put", () -> jdbcTemplate.update(
            """
            INSERT INTO mod_index_entries (namespace, entry_key, entry_value)
            VALUES (?, ?, ?)
            ON CONFLICT (namespace, entry_key) DO UPDATE SET entry_value = EXCLUDED.entry_value, updated_at = NOW()
            """,
            namespace, key, value
        ));
    }

    @Override
    public boolean delete(String key) {
        return StoreRetrySupport.execute(retryConfig, namespace + " delete", () -> jdbcTemplate.update(
            "DELETE FROM mod_index_entries WHERE namespace = ? AND entry_key = ?",
            namespace, key
        ) > 0);
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        return StoreRetrySupport.execute(retryConfig, namespace + " deleteIfValue", () -> jdbcTemplate.update(
            "DELETE FROM mod_index_entries WHERE namespace = ? AND entry_key = ? AND entry_value = ?",
            namespace, key, expectedValue
        ) > 0);
    }

    @Override
    public List<String> keys() {
        return StoreRetrySupport.execute(retryConfig, namespace + " keys", () -> jdbcTemplate.queryForList(
            "SELECT entry_key FROM mod_index_entries WHERE namespace = ? ORDER BY entry_key",
            String.class,
            namespace
        ));
    }

    @Override
    public String namespace() {
        return namespace;
    }

    private Optional<String> selectValue(String key) {
        List<String> values = jdbcTemplate.queryForList(
            "SELECT entry_value FROM mod_index_entries WHERE namespace = ? AND entry_key = ?",
            String.class,
            namespace, key
        );
        return values.stream().findFirst();
    }
}

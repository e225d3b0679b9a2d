package net.modshub.config;

import net.modshub.adapters.persistence.JdbcKeyValueStore;
import net.modshub.adapters.persistence.JdbcModRepository;
import net.modshub.repository.KeyValueStore;
import net.modshub.repository.ModRepository;
import net.modshub.support.retry.StoreRetrySupport.RetryConfig;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres-backed storage, active when a datasource URL is configured.
 *
 * <p>Every key-value namespace shares the {@code mod_index_entries} table; records
 * live in {@code mods}. Schema comes from {@code schema.sql}.</p>
 *
 * @see InMemoryStorageConfig
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class DatabaseStorageConfig {

    @Bean
    public ModRepository modRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, ModsProperties properties) {
        return new JdbcModRepository(jdbcTemplate, objectMapper, retryConfig(JdbcModRepository.class, properties));
    }

    @Bean
    @Qualifier(ModIndexConfig.RESERVATION_NAMESPACE)
    public KeyValueStore reservationStore(JdbcTemplate jdbcTemplate, ModsProperties properties) {
        return new JdbcKeyValueStore(jdbcTemplate, ModIndexConfig.RESERVATION_NAMESPACE,
            retryConfig(JdbcKeyValueStore.class, properties));
    }

    @Bean
    @Qualifier(ModIndexConfig.PUBLIC_NAMESPACE)
    public KeyValueStore publicStore(JdbcTemplate jdbcTemplate, ModsProperties properties) {
        return new JdbcKeyValueStore(jdbcTemplate, ModIndexConfig.PUBLIC_NAMESPACE,
            retryConfig(JdbcKeyValueStore.class, properties));
    }

    @Bean
    @Qualifier(ModIndexConfig.WRITE_LOCK_NAMESPACE)
    public KeyValueStore writeLockStore(JdbcTemplate jdbcTemplate, ModsProperties properties) {
        return new JdbcKeyValueStore(jdbcTemplate, ModIndexConfig.WRITE_LOCK_NAMESPACE,
            retryConfig(JdbcKeyValueStore.class, properties));
    }

    @Bean
    @Qualifier(ModIndexConfig.UPLOADER_APPROVAL_NAMESPACE)
    public KeyValueStore uploaderApprovalStore(JdbcTemplate jdbcTemplate, ModsProperties properties) {
        return new JdbcKeyValueStore(jdbcTemplate, ModIndexConfig.UPLOADER_APPROVAL_NAMESPACE,
            retryConfig(JdbcKeyValueStore.class, properties));
    }

    private static RetryConfig retryConfig(Class<?> owner, ModsProperties properties) {
        ModsProperties.Store store = properties.getStore();
        return new RetryConfig(
            LoggerFactory.getLogger(owner),
            store.getRetryMaxAttempts(),
            store.getRetryBaseBackoff().toMillis()
        );
    }
}

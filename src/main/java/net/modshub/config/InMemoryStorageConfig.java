/**
 * Configuration for running without a database.
 *
 * Activates when no datasource URL is configured and backs the mod record store and
 * both slug indices, the write leases and uploader approvals with process-local
 * concurrent maps. Data does not survive a restart.
 * The DataSource auto-configuration itself is switched off by
 * {@link ModsEnvironmentPostProcessor} in the same situation.
 */
package net.modshub.config;

import net.modshub.repository.InMemoryKeyValueStore;
import net.modshub.repository.InMemoryModRepository;
import net.modshub.repository.KeyValueStore;
import net.modshub.repository.ModRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryStorageConfig {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageConfig.class);

    @Bean
    public ModRepository modRepository() {
        log.warn("No datasource configured: mods and slug indices are held in memory only");
        return new InMemoryModRepository();
    }

    @Bean
    @Qualifier(ModIndexConfig.RESERVATION_NAMESPACE)
    public KeyValueStore reservationStore() {
        return new InMemoryKeyValueStore(ModIndexConfig.RESERVATION_NAMESPACE);
    }

    @Bean
    @Qualifier(ModIndexConfig.PUBLIC_NAMESPACE)
    public KeyValueStore publicStore() {
        return new InMemoryKeyValueStore(ModIndexConfig.PUBLIC_NAMESPACE);
    }

    @Bean
    @Qualifier(ModIndexConfig.WRITE_LOCK_NAMESPACE)
    public KeyValueStore writeLockStore() {
        return new InMemoryKeyValueStore(ModIndexConfig.WRITE_LOCK_NAMESPACE);
    }

    @Bean
    @Qualifier(ModIndexConfig.UPLOADER_APPROVAL_NAMESPACE)
    public KeyValueStore uploaderApprovalStore() {
        return new InMemoryKeyValueStore(ModIndexConfig.UPLOADER_APPROVAL_NAMESPACE);
    }
}

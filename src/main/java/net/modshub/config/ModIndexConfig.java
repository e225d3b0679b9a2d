package net.modshub.config;

import java.time.Clock;
import net.modshub.repository.KeyValueStore;
import net.modshub.service.UploaderApprovalService;
import net.modshub.service.index.PublicExposureIndex;
import net.modshub.service.index.SlugReservationIndex;
import net.modshub.service.lock.ModWriteLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the slug indices, the per-mod write lock and uploader approvals onto whichever
 * key-value stores the active storage configuration provides, plus the clock used for
 * ids and timestamps.
 */
@Configuration
public class ModIndexConfig {

    public static final String RESERVATION_NAMESPACE = "reservation";
    public static final String PUBLIC_NAMESPACE = "public";
    public static final String WRITE_LOCK_NAMESPACE = "write_lock";
    public static final String UPLOADER_APPROVAL_NAMESPACE = "uploader_approval";

    @Bean
    public SlugReservationIndex slugReservationIndex(@Qualifier(RESERVATION_NAMESPACE) KeyValueStore reservationStore) {
        return new SlugReservationIndex(reservationStore);
    }

    @Bean
    public PublicExposureIndex publicExposureIndex(@Qualifier(PUBLIC_NAMESPACE) KeyValueStore publicStore) {
        return new PublicExposureIndex(publicStore);
    }

    @Bean
    public ModWriteLock modWriteLock(@Qualifier(WRITE_LOCK_NAMESPACE) KeyValueStore writeLockStore,
                                     Clock clock,
                                     ModsProperties properties) {
        ModsProperties.WriteLock settings = properties.getWriteLock();
        return new ModWriteLock(writeLockStore, clock, settings.getLeaseTimeout(),
            settings.getAcquireAttempts(), settings.getAcquireBackoff());
    }

    @Bean
    public UploaderApprovalService uploaderApprovalService(
            @Qualifier(UPLOADER_APPROVAL_NAMESPACE) KeyValueStore uploaderApprovalStore,
            ModsProperties properties) {
        return new UploaderApprovalService(uploaderApprovalStore, properties);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package net.modshub.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for mod resolution, store clients and listings.
 */
@Component
@ConfigurationProperties(prefix = "app.mods")
@Getter
@Setter
public class ModsProperties {

    private Resolution resolution = new Resolution();

    private Store store = new Store();

    private Listing listing = new Listing();

    private WriteLock writeLock = new WriteLock();

    private Uploads uploads = new Uploads();

    @PostConstruct
    void validate() {
        Assert.isTrue(!resolution.staleIndexGrace.isNegative(),
                "app.mods.resolution.stale-index-grace must be non-negative");
        Assert.isTrue(store.retryMaxAttempts >= 1, "app.mods.store.retry-max-attempts must be at least 1");
        Assert.isTrue(!store.retryBaseBackoff.isNegative(), "app.mods.store.retry-base-backoff must be non-negative");
        Assert.isTrue(writeLock.leaseTimeout.toMillis() >= 1, "app.mods.write-lock.lease-timeout must be positive");
        Assert.isTrue(writeLock.acquireAttempts >= 1, "app.mods.write-lock.acquire-attempts must be at least 1");
        Assert.isTrue(!writeLock.acquireBackoff.isNegative(), "app.mods.write-lock.acquire-backoff must be non-negative");
        Assert.isTrue(listing.maxPageSize >= 1, "app.mods.listing.max-page-size must be at least 1");
        Assert.isTrue(listing.defaultPageSize >= 1 && listing.defaultPageSize <= listing.maxPageSize,
                "app.mods.listing.default-page-size must be between 1 and max-page-size");
    }

    @Getter
    @Setter
    public static class Resolution {

        /**
         * Whether a slug lookup that lands on a missing record deletes the stale index entries.
         */
        private boolean selfHeal = true;

        /**
         * Minimum age (from the id's embedded timestamp) before a stale entry may be healed,
         * so reservations of creates still in flight are left alone.
         */
        private Duration staleIndexGrace = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Store {

        /**
         * Attempts per store call on transient data-access failures.
         */
        private int retryMaxAttempts = 3;

        /**
         * Linear backoff base between attempts.
         */
        private Duration retryBaseBackoff = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class Listing {

        private int defaultPageSize = 20;

        private int maxPageSize = 100;
    }

    @Getter
    @Setter
    public static class WriteLock {

        /**
         * Age after which a write lease is considered abandoned and may be taken over.
         */
        private Duration leaseTimeout = Duration.ofSeconds(30);

        private int acquireAttempts = 5;

        private Duration acquireBackoff = Duration.ofMillis(20);
    }

    @Getter
    @Setter
    public static class Uploads {

        /**
         * When true, only admins and users on the approved uploader list may create mods.
         */
        private boolean requireApproval = true;
    }
}

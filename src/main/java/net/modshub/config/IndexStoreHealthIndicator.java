package net.modshub.config;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.modshub.service.index.SlugReservationIndex;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component("indexStore")
public class IndexStoreHealthIndicator implements ReactiveHealthIndicator {

    static final String PROBE_SLUG = "__health_probe__";
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final SlugReservationIndex reservationIndex;
    private final String storageMode;

    public IndexStoreHealthIndicator(SlugReservationIndex reservationIndex, Environment environment) {
        this.reservationIndex = reservationIndex;
        this.storageMode = StringUtils.hasText(environment.getProperty("spring.datasource.url")) ? "postgres" : "in-memory";
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    reservationIndex.lookup(PROBE_SLUG);
                    return Health.up()
                            .withDetail("index_status", "available")
                            .withDetail("storage", storageMode)
                            .build();
                })
                .timeout(PROBE_TIMEOUT)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(TimeoutException.class, ex -> Mono.just(Health.down()
                        .withDetail("index_status", "timeout")
                        .withDetail("storage", storageMode)
                        .withDetail("message", String.valueOf(ex.getMessage()))
                        .build()))
                .onErrorResume(DataAccessException.class, ex -> Mono.just(Health.down()
                        .withDetail("index_status", "store_error")
                        .withDetail("storage", storageMode)
                        .withDetail("error", ex.getClass().getName())
                        .withDetail("message", String.valueOf(ex.getMessage()))
                        .build()))
                .onErrorResume(Throwable.class, ex -> Mono.just(Health.down()
                        .withDetail("index_status", "unexpected_error")
                        .withDetail("storage", storageMode)
                        .withDetail("error", ex.getClass().getName())
                        .build()));
    }
}

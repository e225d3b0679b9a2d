package net.modshub.controller.support;

import java.util.concurrent.Callable;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Common reactive controller patterns for endpoints backed by blocking store calls.
 */
public final class ReactiveControllerUtils {

    private ReactiveControllerUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Runs a blocking call off the request thread. Errors propagate to the MVC
     * exception handlers unchanged.
     */
    public static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 200 OK with the mapped body.
     */
    public static <T> Mono<ResponseEntity<T>> ok(Mono<T> body) {
        return body.map(ResponseEntity::ok);
    }
}

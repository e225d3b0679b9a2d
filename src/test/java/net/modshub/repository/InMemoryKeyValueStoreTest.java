package net.modshub.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore("reservation");

    @Test
    void should_WriteOnlyOnce_When_KeyIsClaimedTwice() {
        assertThat(store.putIfAbsent("first-mod", "mod_1_aaaaaaaa")).isEmpty();
        assertThat(store.putIfAbsent("first-mod", "mod_2_bbbbbbbb")).contains("mod_1_aaaaaaaa");
        assertThat(store.get("first-mod")).contains("mod_1_aaaaaaaa");
    }

    @Test
    void should_DeleteOnlyMatchingValue_When_DeleteIfValue() {
        store.put("first-mod", "mod_1_aaaaaaaa");

        assertThat(store.deleteIfValue("first-mod", "mod_2_bbbbbbbb")).isFalse();
        assertThat(store.get("first-mod")).contains("mod_1_aaaaaaaa");
        assertThat(store.deleteIfValue("first-mod", "mod_1_aaaaaaaa")).isTrue();
        assertThat(store.get("first-mod")).isEmpty();
        assertThat(store.deleteIfValue("first-mod", "mod_1_aaaaaaaa")).isFalse();
    }

    @Test
    void should_TreatMissingKeyDeleteAsNoOp() {
        assertThat(store.delete("missing")).isFalse();
        store.put("present", "mod_1_aaaaaaaa");
        assertThat(store.delete("present")).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void should_OverwriteValue_When_PutRepeats() {
        store.put("alice", "root");
        store.put("alice", "ops");

        assertThat(store.get("alice")).contains("ops");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void should_ListKeysInAscendingOrder() {
        store.putIfAbsent("zeta-mod", "mod_1_aaaaaaaa");
        store.putIfAbsent("alpha-mod", "mod_2_bbbbbbbb");
        store.putIfAbsent("mid-mod", "mod_3_cccccccc");

        assertThat(store.keys()).containsExactly("alpha-mod", "mid-mod", "zeta-mod");
    }

    @Test
    void should_LetExactlyOneClaimWin_When_ClaimsRace() throws Exception {
        int contenders = 16;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<String>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String modId = "mod_" + i + "_contender";
                results.add(executor.submit(() -> {
                    start.await();
                    return store.putIfAbsent("hot-slug", modId);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Optional<String>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isEmpty()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(store.size()).isEqualTo(1);
    }
}

package net.modshub.repository;

import java.time.Instant;
import net.modshub.domain.Mod;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryModRepositoryTest {

    private final InMemoryModRepository repository = new InMemoryModRepository();

    private static Mod mod() {
        Instant createdAt = Instant.parse("2025-03-01T12:00:00Z");
        return Mod.builder()
            .modId("mod_1_aaaaaaaa")
            .slug("first-mod")
            .title("First Mod")
            .category(ModCategory.OTHER)
            .visibility(ModVisibility.PUBLIC)
            .status(ModStatus.PENDING)
            .ownerId("alice")
            .createdAt(createdAt)
            .updatedAt(createdAt)
            .build();
    }

    @Test
    void should_RejectSecondInsert_When_IdAlreadyStored() {
        repository.insert(mod());

        assertThatThrownBy(() -> repository.insert(mod())).isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void should_ReplaceOnlyFromCurrentVersion() {
        Mod original = mod();
        repository.insert(original);
        Mod renamed = original.nextRevision().slug("second-mod").build();
        Mod approvedFromStale = original.nextRevision().status(ModStatus.APPROVED).build();

        assertThat(repository.replace(original, renamed)).isTrue();
        assertThat(repository.replace(original, approvedFromStale)).isFalse();
        assertThat(repository.findById(original.getModId())).contains(renamed);
    }

    @Test
    void should_RefuseReplace_When_RecordWasDeleted() {
        Mod original = mod();
        repository.insert(original);
        repository.deleteById(original.getModId());

        assertThat(repository.replace(original, original.nextRevision().build())).isFalse();
        assertThat(repository.findById(original.getModId())).isEmpty();
    }

    @Test
    void should_Reject_When_ReplacementSkipsVersion() {
        Mod original = mod();
        repository.insert(original);

        assertThatThrownBy(() -> repository.replace(original, original.toBuilder().title("Same Version").build()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

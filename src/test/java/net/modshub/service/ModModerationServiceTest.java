package net.modshub.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import net.modshub.repository.ModRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModModerationServiceTest {

    private static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2025-02-01T00:00:00Z");

    @Mock
    private ModRepository modRepository;

    private ModModerationService moderationService;
    private Mod pending;

    @BeforeEach
    void setUp() {
        moderationService = new ModModerationService(modRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        pending = Mod.builder()
            .modId("mod_1_aaaaaaaa")
            .slug("first-mod")
            .title("First Mod")
            .category(ModCategory.OTHER)
            .visibility(ModVisibility.PUBLIC)
            .status(ModStatus.PENDING)
            .ownerId("alice")
            .createdAt(CREATED)
            .updatedAt(CREATED)
            .build();
    }

    @Test
    void should_ReplaceWithNextVersion_When_AdminApproves() {
        when(modRepository.findById("mod_1_aaaaaaaa")).thenReturn(Optional.of(pending));
        when(modRepository.replace(any(), any())).thenReturn(true);

        Mod approved = moderationService.updateStatus("mod_1_aaaaaaaa", ModStatus.APPROVED, "looks good", CallerContext.admin("root"));

        ArgumentCaptor<Mod> saved = ArgumentCaptor.forClass(Mod.class);
        verify(modRepository).replace(eq(pending), saved.capture());
        assertThat(saved.getValue()).isEqualTo(approved);
        assertThat(approved.getStatus()).isEqualTo(ModStatus.APPROVED);
        assertThat(approved.getVersion()).isEqualTo(pending.getVersion() + 1);
        assertThat(approved.getUpdatedAt()).isEqualTo(NOW);
        assertThat(approved.getSlug()).isEqualTo("first-mod");
        assertThat(approved.getVisibility()).isEqualTo(ModVisibility.PUBLIC);
    }

    @Test
    void should_ApplyStatusToFreshRecord_When_RecordChangedAfterRead() {
        Mod renamed = pending.nextRevision().slug("second-mod").title("Second Mod").build();
        when(modRepository.findById("mod_1_aaaaaaaa")).thenReturn(Optional.of(pending), Optional.of(renamed));
        when(modRepository.replace(any(), any())).thenReturn(false, true);

        Mod approved = moderationService.updateStatus("mod_1_aaaaaaaa", ModStatus.APPROVED, null, CallerContext.admin("root"));

        assertThat(approved.getSlug()).isEqualTo("second-mod");
        assertThat(approved.getTitle()).isEqualTo("Second Mod");
        assertThat(approved.getStatus()).isEqualTo(ModStatus.APPROVED);
        assertThat(approved.getVersion()).isEqualTo(renamed.getVersion() + 1);
        verify(modRepository).replace(renamed, approved);
    }

    @Test
    void should_GiveUp_When_EveryReplaceLoses() {
        when(modRepository.findById("mod_1_aaaaaaaa")).thenReturn(Optional.of(pending));
        when(modRepository.replace(any(), any())).thenReturn(false);

        assertThatThrownBy(() -> moderationService.updateStatus("mod_1_aaaaaaaa", ModStatus.APPROVED, null, CallerContext.admin("root")))
            .isInstanceOf(ConcurrentModUpdateException.class);
        verify(modRepository, times(ModModerationService.MAX_ATTEMPTS)).replace(any(), any());
    }

    @Test
    void should_SkipWrite_When_StatusUnchanged() {
        when(modRepository.findById("mod_1_aaaaaaaa")).thenReturn(Optional.of(pending));

        Mod result = moderationService.updateStatus("mod_1_aaaaaaaa", ModStatus.PENDING, null, CallerContext.admin("root"));

        assertThat(result).isSameAs(pending);
        verify(modRepository, never()).replace(any(), any());
    }

    @Test
    void should_FlagModAsFeatured_When_AdminFeaturesIt() {
        when(modRepository.findById("mod_1_aaaaaaaa")).thenReturn(Optional.of(pending));
        when(modRepository.replace(any(), any())).thenReturn(true);

        Mod featured = moderationService.setFeatured("mod_1_aaaaaaaa", true, CallerContext.admin("root"));

        assertThat(featured.isFeatured()).isTrue();
        assertThat(featured.getStatus()).isEqualTo(ModStatus.PENDING);
        assertThat(featured.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void should_RejectFeaturing_When_CallerIsNotAdmin() {
        assertThatThrownBy(() -> moderationService.setFeatured("mod_1_aaaaaaaa", true, CallerContext.user("alice")))
            .isInstanceOf(ModAccessDeniedException.class);
        verifyNoInteractions(modRepository);
    }

    @Test
    void should_Reject_When_CallerIsNotAdmin() {
        assertThatThrownBy(() -> moderationService.updateStatus("mod_1_aaaaaaaa", ModStatus.APPROVED, null, CallerContext.user("alice")))
            .isInstanceOf(ModAccessDeniedException.class);
        verifyNoInteractions(modRepository);
    }

    @Test
    void should_ReportNotFound_When_ModIsMissing() {
        when(modRepository.findById("mod_9_missing0")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> moderationService.updateStatus("mod_9_missing0", ModStatus.DENIED, "spam", CallerContext.admin("root")))
            .isInstanceOf(ModNotFoundException.class);
    }
}

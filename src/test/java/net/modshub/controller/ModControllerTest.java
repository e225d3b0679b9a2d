package net.modshub.controller;

import java.util.List;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModVisibility;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import net.modshub.exception.SlugConflictException;
import net.modshub.service.ModChanges;
import net.modshub.service.ModDraft;
import net.modshub.service.ModListQuery;
import net.modshub.service.ModPage;
import net.modshub.service.ModSort;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ModControllerTest extends AbstractModControllerMvcTest {

    private static final String MOD_ID = "mod_1740830400000_k3j9x0abcd";

    @Test
    @DisplayName("POST /mods returns 201 with the new mod and its location")
    void should_Return201_When_ModCreated() throws Exception {
        Mod created = buildMod(MOD_ID, "First Mod", "first-mod", ModVisibility.PUBLIC);
        when(modResolutionService.createMod(any(ModDraft.class), eq(CallerContext.user("alice")))).thenReturn(created);

        mockMvc.perform(post("/mods")
                .principal(user("alice"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"First Mod\",\"category\":\"overlay\",\"tags\":[\"hud\"],\"visibility\":\"public\"}"))
            .andExpect(status().isCreated())
            .andExpect(header().string("Location", "/mods/" + MOD_ID))
            .andExpect(jsonPath("$.mod.modId", equalTo(MOD_ID)))
            .andExpect(jsonPath("$.mod.slug", equalTo("first-mod")))
            .andExpect(jsonPath("$.mod.visibility", equalTo("public")))
            .andExpect(jsonPath("$.mod.status", equalTo("pending")))
            .andExpect(jsonPath("$.mod.authorId", equalTo("alice")))
            .andExpect(jsonPath("$.mod.createdAt", equalTo("2025-03-01T12:00:00Z")));

        ArgumentCaptor<ModDraft> draft = ArgumentCaptor.forClass(ModDraft.class);
        verify(modResolutionService).createMod(draft.capture(), eq(CallerContext.user("alice")));
        assertThat(draft.getValue().category()).isEqualTo(ModCategory.OVERLAY);
        assertThat(draft.getValue().visibility()).isEqualTo(ModVisibility.PUBLIC);
    }

    @Test
    @DisplayName("POST /mods with a taken slug returns 409 Slug Already Exists")
    void should_Return409_When_SlugTaken() throws Exception {
        when(modResolutionService.createMod(any(ModDraft.class), any(CallerContext.class)))
            .thenThrow(new SlugConflictException("first-mod", MOD_ID));

        mockMvc.perform(post("/mods")
                .principal(user("bob"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"First Mod\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.title", equalTo("Slug Already Exists")))
            .andExpect(jsonPath("$.detail", containsString("Slug Already Exists")))
            .andExpect(jsonPath("$.status", equalTo(409)));
    }

    @Test
    void should_Return400_When_CategoryUnknown() throws Exception {
        mockMvc.perform(post("/mods")
                .principal(user("alice"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"First Mod\",\"category\":\"weapons\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail", equalTo("Unknown category: weapons")));

        verifyNoInteractions(modResolutionService);
    }

    @Test
    void should_Return400_When_BodyMissingOrMalformed() throws Exception {
        mockMvc.perform(post("/mods").principal(user("alice")).contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest());
        mockMvc.perform(post("/mods").principal(user("alice")).contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title", equalTo("Invalid Mod Request")));
    }

    @Test
    @DisplayName("GET /mods/{slug} resolves anonymously through the public index")
    void should_ResolveSlug_When_Anonymous() throws Exception {
        Mod mod = buildMod(MOD_ID, "First Mod", "first-mod", ModVisibility.PUBLIC);
        when(modResolutionService.resolve("first-mod", CallerContext.anonymous())).thenReturn(mod);

        performAsync(get("/mods/first-mod"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mod.modId", equalTo(MOD_ID)))
            .andExpect(jsonPath("$.mod.tags[0]", equalTo("hud")));
    }

    @Test
    void should_Return404_When_ModHiddenOrMissing() throws Exception {
        when(modResolutionService.resolve("second-mod", CallerContext.anonymous()))
            .thenThrow(new ModNotFoundException("second-mod"));

        performAsync(get("/mods/second-mod"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.title", equalTo("Mod Not Found")))
            .andExpect(jsonPath("$.instance", equalTo("/mods/second-mod")));
    }

    @Test
    void should_Return403_When_AuthenticatedCallerMayNotView() throws Exception {
        when(modResolutionService.resolve(MOD_ID, CallerContext.user("bob")))
            .thenThrow(new ModAccessDeniedException(MOD_ID, "view"));

        performAsync(get("/mods/" + MOD_ID).principal(user("bob")))
            .andExpect(status().isForbidden());
    }

    @Test
    void should_Return503_When_StoreUnavailable() throws Exception {
        when(modResolutionService.resolve("first-mod", CallerContext.anonymous()))
            .thenThrow(new QueryTimeoutException("index store timed out"));

        performAsync(get("/mods/first-mod"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.title", equalTo("Storage Unavailable")));
    }

    @Test
    void should_PassChangesThrough_When_Patched() throws Exception {
        Mod renamed = buildMod(MOD_ID, "Second Mod", "second-mod", ModVisibility.PRIVATE);
        ModChanges expected = new ModChanges("Second Mod", null, null, null, ModVisibility.PRIVATE);
        when(modResolutionService.updateMod(MOD_ID, expected, CallerContext.user("alice"))).thenReturn(renamed);

        mockMvc.perform(patch("/mods/" + MOD_ID)
                .principal(user("alice"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Second Mod\",\"visibility\":\"private\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mod.slug", equalTo("second-mod")))
            .andExpect(jsonPath("$.mod.visibility", equalTo("private")));
    }

    @Test
    void should_Return204_When_Deleted() throws Exception {
        mockMvc.perform(delete("/mods/" + MOD_ID).principal(user("alice")))
            .andExpect(status().isNoContent());

        verify(modResolutionService).deleteMod(MOD_ID, CallerContext.user("alice"));
    }

    @Test
    void should_Return404_When_DeletingUnknownMod() throws Exception {
        doThrow(new ModNotFoundException(MOD_ID)).when(modResolutionService).deleteMod(MOD_ID, CallerContext.user("alice"));

        mockMvc.perform(delete("/mods/" + MOD_ID).principal(user("alice")))
            .andExpect(status().isNotFound());
    }

    @Test
    void should_ListWithParsedFilters() throws Exception {
        Mod mod = buildMod(MOD_ID, "First Mod", "first-mod", ModVisibility.PUBLIC);
        ModListQuery expected = new ModListQuery(2, 5, ModCategory.OVERLAY, "alice", null, "hud", null, false, ModSort.TITLE);
        when(modCatalogService.listMods(expected, CallerContext.anonymous()))
            .thenReturn(new ModPage(List.of(mod), 6, 2, 5));

        performAsync(get("/mods")
                .param("page", "2")
                .param("pageSize", "5")
                .param("category", "overlay")
                .param("authorId", "alice")
                .param("tag", "hud")
                .param("sort", "title"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mods", hasSize(1)))
            .andExpect(jsonPath("$.total", equalTo(6)))
            .andExpect(jsonPath("$.page", equalTo(2)))
            .andExpect(jsonPath("$.pageSize", equalTo(5)));
    }

    @Test
    void should_Return400_When_SortUnknown() throws Exception {
        performAsync(get("/mods").param("sort", "popular"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail", equalTo("Unknown sort: popular")));
    }

    @Test
    void should_FilterFeatured_When_FeaturedIsTrue() throws Exception {
        Mod mod = buildMod(MOD_ID, "First Mod", "first-mod", ModVisibility.PUBLIC).toBuilder().featured(true).build();
        ModListQuery featuredOnly = new ModListQuery(null, null, null, null, null, null, null, true, null);
        when(modCatalogService.listMods(featuredOnly, CallerContext.anonymous()))
            .thenReturn(new ModPage(List.of(mod), 1, 1, 20));

        performAsync(get("/mods").param("featured", "TRUE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mods[0].featured", equalTo(true)));
    }

    @Test
    void should_IgnoreFeatured_When_ValueIsNotTrue() throws Exception {
        when(modCatalogService.listMods(ModListQuery.defaults(), CallerContext.anonymous()))
            .thenReturn(new ModPage(List.of(), 0, 1, 20));

        performAsync(get("/mods").param("featured", "yes"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total", equalTo(0)));
    }

    @Test
    void should_Return409_When_ConcurrentUpdateWins() throws Exception {
        when(modResolutionService.updateMod(eq(MOD_ID), any(), eq(CallerContext.user("alice"))))
            .thenThrow(new ConcurrentModUpdateException(MOD_ID));

        mockMvc.perform(patch("/mods/" + MOD_ID)
                .principal(user("alice"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Second Mod\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.title", equalTo("Concurrent Modification")))
            .andExpect(jsonPath("$.modId", equalTo(MOD_ID)));
    }
}

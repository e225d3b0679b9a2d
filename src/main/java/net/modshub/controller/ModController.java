package net.modshub.controller;

import java.net.URI;
import net.modshub.controller.dto.CreateModRequest;
import net.modshub.controller.dto.ModEnvelope;
import net.modshub.controller.dto.ModListResponse;
import net.modshub.controller.dto.UpdateModRequest;
import net.modshub.controller.support.CallerContexts;
import net.modshub.controller.support.ModRequestMapper;
import net.modshub.controller.support.ReactiveControllerUtils;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.service.ModCatalogService;
import net.modshub.service.ModListQuery;
import net.modshub.service.ModResolutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Public mod API: create, resolve by id or slug, update, delete and browse.
 */
@RestController
@RequestMapping("/mods")
public class ModController {

    private final ModResolutionService modResolutionService;
    private final ModCatalogService modCatalogService;

    public ModController(ModResolutionService modResolutionService, ModCatalogService modCatalogService) {
        this.modResolutionService = modResolutionService;
        this.modCatalogService = modCatalogService;
    }

    @PostMapping
    public ResponseEntity<ModEnvelope> createMod(@RequestBody(required = false) CreateModRequest request,
                                                 Authentication authentication) {
        Mod mod = modResolutionService.createMod(ModRequestMapper.toDraft(request), CallerContexts.from(authentication));
        return ResponseEntity.created(URI.create("/mods/" + mod.getModId()))
            .body(ModEnvelope.of(mod));
    }

    /**
     * Resolves a mod id or an exact slug. Anonymous callers only ever see public mods.
     */
    @GetMapping("/{identifierOrSlug}")
    public Mono<ResponseEntity<ModEnvelope>> getMod(@PathVariable String identifierOrSlug,
                                                    Authentication authentication) {
        CallerContext caller = CallerContexts.from(authentication);
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> modResolutionService.resolve(identifierOrSlug, caller))
                .map(ModEnvelope::of)
        );
    }

    @GetMapping
    public Mono<ResponseEntity<ModListResponse>> listMods(@RequestParam(required = false) Integer page,
                                                          @RequestParam(required = false) Integer pageSize,
                                                          @RequestParam(required = false) String category,
                                                          @RequestParam(required = false) String authorId,
                                                          @RequestParam(required = false) String visibility,
                                                          @RequestParam(required = false) String tag,
                                                          @RequestParam(required = false) String featured,
                                                          @RequestParam(required = false) String sort,
                                                          Authentication authentication) {
        CallerContext caller = CallerContexts.from(authentication);
        ModListQuery query = new ModListQuery(
            page,
            pageSize,
            ModRequestMapper.category(category),
            authorId,
            ModRequestMapper.visibility(visibility),
            tag,
            null,
            ModRequestMapper.featuredOnly(featured),
            ModRequestMapper.sort(sort)
        );
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> modCatalogService.listMods(query, caller))
                .map(ModListResponse::from)
        );
    }

    @PatchMapping("/{modId}")
    public ResponseEntity<ModEnvelope> patchMod(@PathVariable String modId,
                                                @RequestBody(required = false) UpdateModRequest request,
                                                Authentication authentication) {
        return update(modId, request, authentication);
    }

    @PutMapping("/{modId}")
    public ResponseEntity<ModEnvelope> putMod(@PathVariable String modId,
                                              @RequestBody(required = false) UpdateModRequest request,
                                              Authentication authentication) {
        return update(modId, request, authentication);
    }

    @DeleteMapping("/{modId}")
    public ResponseEntity<Void> deleteMod(@PathVariable String modId, Authentication authentication) {
        modResolutionService.deleteMod(modId, CallerContexts.from(authentication));
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }

    private ResponseEntity<ModEnvelope> update(String modId, UpdateModRequest request, Authentication authentication) {
        Mod mod = modResolutionService.updateMod(
            modId,
            ModRequestMapper.toChanges(request),
            CallerContexts.from(authentication)
        );
        return ResponseEntity.ok(ModEnvelope.of(mod));
    }
}

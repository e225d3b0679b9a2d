package net.modshub.controller;

import net.modshub.controller.dto.ModEnvelope;
import net.modshub.controller.dto.ModFeaturedRequest;
import net.modshub.controller.dto.ModListResponse;
import net.modshub.controller.dto.ModStatusRequest;
import net.modshub.controller.support.CallerContexts;
import net.modshub.controller.support.ModRequestMapper;
import net.modshub.controller.support.ReactiveControllerUtils;
import net.modshub.domain.CallerContext;
import net.modshub.domain.ModStatus;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.service.ModCatalogService;
import net.modshub.service.ModListQuery;
import net.modshub.service.ModModerationService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Admin moderation endpoints. Route access is restricted to ROLE_ADMIN by the
 * security filter chain; the services check the caller again.
 */
@RestController
@RequestMapping("/admin/mods")
public class AdminModController {

    private final ModCatalogService modCatalogService;
    private final ModModerationService modModerationService;

    public AdminModController(ModCatalogService modCatalogService, ModModerationService modModerationService) {
        this.modCatalogService = modCatalogService;
        this.modModerationService = modModerationService;
    }

    @GetMapping
    public Mono<ResponseEntity<ModListResponse>> listMods(@RequestParam(required = false) Integer page,
                                                          @RequestParam(required = false) Integer pageSize,
                                                          @RequestParam(required = false) String status,
                                                          @RequestParam(required = false) String category,
                                                          @RequestParam(required = false) String authorId,
                                                          @RequestParam(required = false) String visibility,
                                                          @RequestParam(required = false) String featured,
                                                          @RequestParam(required = false) String sort,
                                                          Authentication authentication) {
        CallerContext caller = CallerContexts.from(authentication);
        if (!caller.admin()) {
            return Mono.error(ModAccessDeniedException.adminOnly("list all mods"));
        }
        ModListQuery query = new ModListQuery(
            page,
            pageSize,
            ModRequestMapper.category(category),
            authorId,
            ModRequestMapper.visibility(visibility),
            null,
            ModRequestMapper.status(status),
            ModRequestMapper.featuredOnly(featured),
            ModRequestMapper.sort(sort)
        );
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> modCatalogService.listMods(query, caller))
                .map(ModListResponse::from)
        );
    }

    @PutMapping("/{modId}/status")
    public ResponseEntity<ModEnvelope> updateStatus(@PathVariable String modId,
                                                    @RequestBody(required = false) ModStatusRequest request,
                                                    Authentication authentication) {
        ModStatus status = request == null ? null : ModRequestMapper.status(request.status());
        if (status == null) {
            throw new InvalidModRequestException("status is required");
        }
        return ResponseEntity.ok(ModEnvelope.of(
            modModerationService.updateStatus(modId, status, request.reason(), CallerContexts.from(authentication))
        ));
    }

    @PutMapping("/{modId}/featured")
    public ResponseEntity<ModEnvelope> updateFeatured(@PathVariable String modId,
                                                      @RequestBody(required = false) ModFeaturedRequest request,
                                                      Authentication authentication) {
        if (request == null || request.featured() == null) {
            throw new InvalidModRequestException("featured is required");
        }
        return ResponseEntity.ok(ModEnvelope.of(
            modModerationService.setFeatured(modId, request.featured(), CallerContexts.from(authentication))
        ));
    }
}

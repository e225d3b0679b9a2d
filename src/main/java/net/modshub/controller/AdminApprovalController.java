package net.modshub.controller;

import net.modshub.controller.dto.ApprovalResponse;
import net.modshub.controller.dto.ApprovedUploadersResponse;
import net.modshub.controller.support.CallerContexts;
import net.modshub.controller.support.ReactiveControllerUtils;
import net.modshub.domain.CallerContext;
import net.modshub.service.UploaderApprovalService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Manages which users may upload mods.
 */
@RestController
@RequestMapping("/admin/approvals")
public class AdminApprovalController {

    private final UploaderApprovalService uploaderApprovalService;

    public AdminApprovalController(UploaderApprovalService uploaderApprovalService) {
        this.uploaderApprovalService = uploaderApprovalService;
    }

    @GetMapping
    public Mono<ResponseEntity<ApprovedUploadersResponse>> listApproved(Authentication authentication) {
        CallerContext caller = CallerContexts.from(authentication);
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> uploaderApprovalService.listApproved(caller))
                .map(ApprovedUploadersResponse::new)
        );
    }

    @PostMapping("/{userId}")
    public ResponseEntity<ApprovalResponse> approve(@PathVariable String userId, Authentication authentication) {
        uploaderApprovalService.approve(userId, CallerContexts.from(authentication));
        return ResponseEntity.ok(new ApprovalResponse(true, userId.trim()));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<ApprovalResponse> revoke(@PathVariable String userId, Authentication authentication) {
        uploaderApprovalService.revoke(userId, CallerContexts.from(authentication));
        return ResponseEntity.ok(new ApprovalResponse(true, userId.trim()));
    }
}

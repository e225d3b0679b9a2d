package net.modshub.controller.dto;

/**
 * Result of an approve or revoke call. Revoking a user who was never approved still succeeds.
 */
public record ApprovalResponse(boolean success, String userId) {
}

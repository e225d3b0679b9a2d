package net.modshub.controller.dto;

public record ModFeaturedRequest(Boolean featured) {
}

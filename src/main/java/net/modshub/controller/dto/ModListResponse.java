package net.modshub.controller.dto;

import java.util.List;
import net.modshub.service.ModPage;

public record ModListResponse(List<ModResponse> mods, int total, int page, int pageSize) {

    public static ModListResponse from(ModPage page) {
        return new ModListResponse(
            page.mods().stream().map(ModResponse::from).toList(),
            page.total(),
            page.page(),
            page.pageSize()
        );
    }
}

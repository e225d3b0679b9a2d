package net.modshub.service;

import java.util.List;
import net.modshub.domain.Mod;

/**
 * One page of a listing. {@code total} counts every match, not just this page.
 */
public record ModPage(List<Mod> mods, int total, int page, int pageSize) {
}

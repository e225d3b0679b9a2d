package net.modshub.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import net.modshub.config.ModsProperties;
import net.modshub.domain.CallerContext;
import net.modshub.domain.Mod;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.repository.ModRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Browsing and admin listings as a predicate pipeline over mod records.
 * The slug indices are never consulted here.
 */
@Slf4j
@Service
public class ModCatalogService {

    private final ModRepository modRepository;
    private final ModAccessPolicy accessPolicy;
    private final ModsProperties properties;

    public ModCatalogService(ModRepository modRepository,
                             ModAccessPolicy accessPolicy,
                             ModsProperties properties) {
        this.modRepository = modRepository;
        this.accessPolicy = accessPolicy;
        this.properties = properties;
    }

    /**
     * Lists the mods the caller may see that match every supplied filter.
     */
    public ModPage listMods(ModListQuery query, CallerContext caller) {
        int page = query.page() != null ? query.page() : 1;
        int pageSize = query.pageSize() != null ? query.pageSize() : properties.getListing().getDefaultPageSize();
        if (page < 1) {
            throw new InvalidModRequestException("page must be at least 1");
        }
        int maxPageSize = properties.getListing().getMaxPageSize();
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new InvalidModRequestException("pageSize must be between 1 and " + maxPageSize);
        }

        Predicate<Mod> filter = buildFilter(query, caller);
        ModSort sort = query.sort() != null ? query.sort() : ModSort.NEWEST;
        List<Mod> matches = modRepository.findAll().stream()
            .filter(filter)
            .sorted(sort.comparator())
            .toList();

        long offset = (long) (page - 1) * pageSize;
        List<Mod> pageItems = matches.stream()
            .skip(offset)
            .limit(pageSize)
            .toList();
        log.debug("Listed {} of {} mods (page {}, size {}) for {}",
            pageItems.size(), matches.size(), page, pageSize, caller.isAuthenticated() ? caller.userId() : "anonymous");
        return new ModPage(pageItems, matches.size(), page, pageSize);
    }

    private Predicate<Mod> buildFilter(ModListQuery query, CallerContext caller) {
        List<Predicate<Mod>> predicates = new ArrayList<>();
        predicates.add(mod -> accessPolicy.canView(caller, mod));
        if (query.category() != null) {
            predicates.add(mod -> mod.getCategory() == query.category());
        }
        if (StringUtils.hasText(query.authorId())) {
            predicates.add(mod -> query.authorId().equals(mod.getOwnerId()));
        }
        if (query.visibility() != null) {
            predicates.add(mod -> mod.getVisibility() == query.visibility());
        }
        if (StringUtils.hasText(query.tag())) {
            String tag = query.tag().trim().toLowerCase(Locale.ROOT);
            predicates.add(mod -> mod.getTags().contains(tag));
        }
        if (query.status() != null) {
            predicates.add(mod -> mod.getStatus() == query.status());
        }
        if (query.featuredOnly()) {
            predicates.add(Mod::isFeatured);
        }
        return predicates.stream().reduce(mod -> true, Predicate::and);
    }
}

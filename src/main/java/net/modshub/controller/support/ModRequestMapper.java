package net.modshub.controller.support;

import java.util.Optional;
import java.util.function.Function;
import net.modshub.controller.dto.CreateModRequest;
import net.modshub.controller.dto.UpdateModRequest;
import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.service.ModChanges;
import net.modshub.service.ModDraft;
import net.modshub.service.ModSort;

/**
 * Converts wire request bodies and query parameters into service commands,
 * rejecting unknown enum values with a 400.
 */
public final class ModRequestMapper {

    private ModRequestMapper() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static ModDraft toDraft(CreateModRequest request) {
        if (request == null) {
            throw new InvalidModRequestException("Request body is required");
        }
        return new ModDraft(
            request.title(),
            request.description(),
            category(request.category()),
            request.tags(),
            visibility(request.visibility())
        );
    }

    public static ModChanges toChanges(UpdateModRequest request) {
        if (request == null) {
            return ModChanges.none();
        }
        return new ModChanges(
            request.title(),
            request.description(),
            category(request.category()),
            request.tags(),
            visibility(request.visibility())
        );
    }

    public static ModCategory category(String value) {
        return parse(value, "category", ModCategory::fromWireValue);
    }

    public static ModVisibility visibility(String value) {
        return parse(value, "visibility", ModVisibility::fromWireValue);
    }

    public static ModStatus status(String value) {
        return parse(value, "status", ModStatus::fromWireValue);
    }

    public static ModSort sort(String value) {
        return parse(value, "sort", ModSort::fromWireValue);
    }

    /** Only the literal {@code true} (any case) narrows a listing to featured mods. */
    public static boolean featuredOnly(String value) {
        return value != null && "true".equalsIgnoreCase(value.trim());
    }

    private static <T> T parse(String value, String field, Function<String, Optional<T>> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parser.apply(value.trim())
            .orElseThrow(() -> new InvalidModRequestException("Unknown " + field + ": " + value));
    }
}

package net.modshub.domain;

/**
 * Shapes a user-supplied mod identifier can take.
 */
public enum ModIdentifierType {
    MOD_ID,
    SLUG,
    UNKNOWN
}

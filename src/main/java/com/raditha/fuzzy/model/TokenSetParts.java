package com.raditha.fuzzy.model;

/**
 * The three strings compared by the token set ratio. Each is built from
 * sorted, space-joined tokens and trimmed.
 *
 * @param intersection Tokens present in both strings
 * @param combined1    {@code intersection} followed by the tokens only in the first string
 * @param combined2    {@code intersection} followed by the tokens only in the second string
 */
public record TokenSetParts(
        String intersection,
        String combined1,
        String combined2) {
}

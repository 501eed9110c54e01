package com.libragraph.revisions.types;

/**
 * A titled content unit within a document; the atomic unit for diffing.
 *
 * <p>{@code order} is boxed so that a missing value can be told apart from zero
 * during validation.
 */
public record Section(String title, String content, Integer order) {
}

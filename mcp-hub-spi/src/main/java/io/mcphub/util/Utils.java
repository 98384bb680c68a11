/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Merge {@code overlay} on top of {@code base}. Entries of the overlay replace entries
	 * of the base with the same key. Either argument may be {@code null}.
	 * @param base the base mapping
	 * @param overlay the mapping applied last
	 * @return an unmodifiable, insertion-ordered copy of the merged mapping
	 */
	public static Map<String, String> overlay(@Nullable Map<String, String> base,
			@Nullable Map<String, String> overlay) {
		Map<String, String> merged = new LinkedHashMap<>();
		if (base != null) {
			merged.putAll(base);
		}
		if (overlay != null) {
			merged.putAll(overlay);
		}
		return Collections.unmodifiableMap(merged);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.catalog;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.mcphub.error.HubException;
import io.mcphub.util.Assert;

/**
 * A capability search request. The pattern uses {@link Pattern} syntax and matches when
 * it is found anywhere in the searched text.
 *
 * @param pattern the regular expression
 * @param scope the fields to search, {@link SearchScope#BOTH} when {@code null}
 * @param caseSensitive whether matching is case-sensitive
 */
public record SearchSpec(String pattern, SearchScope scope, boolean caseSensitive) {

	public SearchSpec {
		Assert.notNull(pattern, "Search pattern must not be null");
		if (scope == null) {
			scope = SearchScope.BOTH;
		}
	}

	/**
	 * A case-insensitive search over names and descriptions.
	 */
	public static SearchSpec of(String pattern) {
		return new SearchSpec(pattern, SearchScope.BOTH, false);
	}

	/**
	 * A case-insensitive search over the given scope.
	 */
	public static SearchSpec of(String pattern, SearchScope scope) {
		return new SearchSpec(pattern, scope, false);
	}

	/**
	 * Compile the pattern.
	 * @return the compiled pattern
	 * @throws HubException {@code INVALID_PATTERN} if the pattern does not compile
	 */
	public Pattern compile() {
		int flags = this.caseSensitive ? 0 : (Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		try {
			return Pattern.compile(this.pattern, flags);
		}
		catch (PatternSyntaxException e) {
			throw HubException.invalidPattern(this.pattern, e);
		}
	}

}

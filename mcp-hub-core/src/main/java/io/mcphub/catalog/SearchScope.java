/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.catalog;

/**
 * Which capability fields a search pattern is matched against.
 */
public enum SearchScope {

	NAME(true, false),

	DESCRIPTION(false, true),

	BOTH(true, true);

	private final boolean names;

	private final boolean descriptions;

	SearchScope(boolean names, boolean descriptions) {
		this.names = names;
		this.descriptions = descriptions;
	}

	public boolean includesName() {
		return this.names;
	}

	public boolean includesDescription() {
		return this.descriptions;
	}

}

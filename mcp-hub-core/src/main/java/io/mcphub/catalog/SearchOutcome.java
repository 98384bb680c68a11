/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.catalog;

import java.util.List;

/**
 * Per-backend result of a search across all connected backends.
 */
public sealed interface SearchOutcome permits SearchOutcome.Found, SearchOutcome.Failed {

	/**
	 * The backend answered and at least one capability matched.
	 *
	 * @param capabilities the matches in listing order
	 */
	record Found(List<CapabilitySummary> capabilities) implements SearchOutcome {

		public Found {
			capabilities = List.copyOf(capabilities);
		}

	}

	/**
	 * The backend's listing failed. Stands in for its matches so that the failure is
	 * visible without discarding the other backends' results.
	 *
	 * @param error the failure message
	 */
	record Failed(String error) implements SearchOutcome {
	}

}

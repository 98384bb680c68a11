/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a bootstrap pass did with each server entry.
 *
 * @param connected backends connected by this pass, in connect order
 * @param skipped backends left alone because they were already connected
 * @param failures backends that failed to connect, with the failure
 */
public record BootstrapReport(List<String> connected, List<String> skipped, Map<String, RuntimeException> failures) {

	public BootstrapReport {
		connected = List.copyOf(connected);
		skipped = List.copyOf(skipped);
		failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
	}

	public static BootstrapReport empty() {
		return new BootstrapReport(List.of(), List.of(), Map.of());
	}

	public boolean hasFailures() {
		return !this.failures.isEmpty();
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.mcphub.util.Utils;

/**
 * Finds the blueprint id a hub should load its servers from. The environment variable
 * {@value #ENVIRONMENT_VARIABLE} wins over the {@value #ARGUMENT} command-line option.
 */
public final class BlueprintIdResolver {

	public static final String ENVIRONMENT_VARIABLE = "MCP_BLUEPRINT_ID";

	public static final String ARGUMENT = "--blueprint-id";

	private BlueprintIdResolver() {
	}

	/**
	 * Resolve the blueprint id.
	 * @param environment the process environment, may be {@code null}
	 * @param args the command-line arguments, may be {@code null}
	 * @return the blueprint id, or empty if neither source provides one
	 */
	public static Optional<String> resolve(Map<String, String> environment, List<String> args) {
		if (environment != null && Utils.hasText(environment.get(ENVIRONMENT_VARIABLE))) {
			return Optional.of(environment.get(ENVIRONMENT_VARIABLE));
		}
		if (args != null) {
			int index = args.indexOf(ARGUMENT);
			if (index != -1 && index < args.size() - 1) {
				return Optional.ofNullable(args.get(index + 1));
			}
		}
		return Optional.empty();
	}

}

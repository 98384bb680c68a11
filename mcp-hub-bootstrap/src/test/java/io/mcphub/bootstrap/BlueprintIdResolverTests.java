/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BlueprintIdResolverTests {

	@Test
	void environmentWinsOverArguments() {
		assertThat(BlueprintIdResolver.resolve(Map.of("MCP_BLUEPRINT_ID", "from-env"),
				List.of("--blueprint-id", "from-args")))
			.contains("from-env");
	}

	@Test
	void argumentFollowingOptionIsUsed() {
		assertThat(BlueprintIdResolver.resolve(Map.of(), List.of("--verbose", "--blueprint-id", "bp-42")))
			.contains("bp-42");
	}

	@Test
	void optionWithoutValueIsIgnored() {
		assertThat(BlueprintIdResolver.resolve(Map.of(), List.of("--blueprint-id"))).isEmpty();
	}

	@Test
	void blankEnvironmentValueFallsBackToArguments() {
		assertThat(BlueprintIdResolver.resolve(Map.of("MCP_BLUEPRINT_ID", " "), List.of("--blueprint-id", "bp-1")))
			.contains("bp-1");
	}

	@Test
	void nothingConfigured() {
		assertThat(BlueprintIdResolver.resolve(null, null)).isEmpty();
	}

}

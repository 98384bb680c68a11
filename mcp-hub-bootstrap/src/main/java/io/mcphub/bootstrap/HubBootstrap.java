/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.mcphub.error.HubErrorKind;
import io.mcphub.error.HubException;
import io.mcphub.registry.BackendRegistry;
import io.mcphub.util.Assert;
import io.mcphub.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects the backends of a server map to a {@link BackendRegistry}. Entries are
 * connected one at a time in declaration order so that the registry lists them in that
 * order. A failing entry is logged and recorded; it does not stop the others.
 *
 * @author MCP Hub contributors
 */
public class HubBootstrap {

	private static final Logger logger = LoggerFactory.getLogger(HubBootstrap.class);

	private final BackendRegistry registry;

	private final HubConfigLoader configLoader;

	public HubBootstrap(BackendRegistry registry) {
		this(registry, HubConfigLoader.builder().build());
	}

	public HubBootstrap(BackendRegistry registry, HubConfigLoader configLoader) {
		Assert.notNull(registry, "Registry must not be null");
		Assert.notNull(configLoader, "Config loader must not be null");
		this.registry = registry;
		this.configLoader = configLoader;
	}

	/**
	 * Fetch a blueprint's server map and connect its backends.
	 * @param blueprintId the blueprint id
	 * @return the outcome per backend
	 * @throws IllegalArgumentException if no blueprint id is given
	 * @throws HubConfigException if the blueprint cannot be fetched
	 */
	public BootstrapReport loadBlueprint(String blueprintId) {
		Assert.hasText(blueprintId, "Blueprint ID not specified.");
		return connectAll(this.configLoader.fetchBlueprint(blueprintId));
	}

	/**
	 * Read a server map from a file and connect its backends.
	 * @param path the configuration file
	 * @return the outcome per backend
	 * @throws HubConfigException if the file cannot be read or parsed
	 */
	public BootstrapReport loadFile(Path path) {
		return connectAll(this.configLoader.load(path));
	}

	/**
	 * Load the blueprint named by the environment or the command line, if any.
	 * @param environment the process environment
	 * @param args the command-line arguments
	 * @return the outcome per backend, empty when no blueprint id is configured
	 * @see BlueprintIdResolver
	 */
	public BootstrapReport autoLoad(Map<String, String> environment, List<String> args) {
		Optional<String> blueprintId = BlueprintIdResolver.resolve(environment, args);
		if (blueprintId.isEmpty()) {
			logger.debug("No blueprint id configured, nothing to load");
			return BootstrapReport.empty();
		}
		return loadBlueprint(blueprintId.get());
	}

	/**
	 * Connect every backend of a server map that is not connected yet.
	 * @param config the server map
	 * @return the outcome per backend
	 */
	public BootstrapReport connectAll(HubConfig config) {
		Assert.notNull(config, "Config must not be null");
		if (Utils.isEmpty(config.mcpServers())) {
			logger.warn("No server information in configuration.");
			return BootstrapReport.empty();
		}

		List<String> connected = new ArrayList<>();
		List<String> skipped = new ArrayList<>();
		Map<String, RuntimeException> failures = new LinkedHashMap<>();

		config.mcpServers().forEach((name, serverConfig) -> {
			if (this.registry.isConnected(name)) {
				skipped.add(name);
				return;
			}
			try {
				this.registry.connect(name, serverConfig);
				connected.add(name);
			}
			catch (HubException e) {
				if (e.getKind() == HubErrorKind.ALREADY_CONNECTED) {
					skipped.add(name);
				}
				else {
					logger.error("Failed to connect to backend '{}' from configuration: {}", name, e.getMessage());
					failures.put(name, e);
				}
			}
			catch (RuntimeException e) {
				logger.error("Failed to connect to backend '{}' from configuration: {}", name, e.getMessage());
				failures.put(name, e);
			}
		});

		logger.info("Bootstrap connected {} backend(s), skipped {}, failed {}", connected.size(), skipped.size(),
				failures.size());
		return new BootstrapReport(connected, skipped, failures);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The transports a backend server can be reached through.
 */
public enum TransportType {

	/**
	 * A spawned child process speaking newline-delimited JSON-RPC over its standard
	 * input and output.
	 */
	STDIO(List.of("stdio")),

	/**
	 * The Streamable HTTP transport.
	 */
	STREAMABLE_HTTP(List.of("http", "streamable-http", "streamablehttp"));

	private final List<String> names;

	TransportType(List<String> names) {
		this.names = names;
	}

	/**
	 * The name used for this transport in server configuration files.
	 * @return the canonical configuration name
	 */
	public String configName() {
		return this.names.get(0);
	}

	/**
	 * Look up a transport by its configuration name, ignoring case.
	 * @param name the configured {@code type} value
	 * @return the matching transport, or empty if the name is unknown
	 */
	public static Optional<TransportType> fromName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (TransportType type : values()) {
			if (type.names.contains(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}

}

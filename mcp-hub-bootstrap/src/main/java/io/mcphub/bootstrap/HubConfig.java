/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.mcphub.session.ServerConfig;

/**
 * A server map: backend names to their server entries, in declaration order.
 *
 * <pre>{@code
 * {
 *   "mcpServers": {
 *     "files": { "command": "npx", "args": ["-y", "@modelcontextprotocol/server-filesystem", "/tmp"] },
 *     "search": { "type": "http", "url": "https://example.com/mcp" }
 *   }
 * }
 * }</pre>
 *
 * @param mcpServers the server entries keyed by backend name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HubConfig(@JsonProperty("mcpServers") Map<String, ServerConfig> mcpServers) {
}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.mcphub.util.Utils;

/**
 * A server entry as it appears in a server map, before the transport is decided.
 *
 * <pre>{@code
 * "filesystem": {
 *   "command": "npx",
 *   "args": ["-y", "@modelcontextprotocol/server-filesystem", "/tmp"],
 *   "env": {"DEBUG": "1"}
 * },
 * "remote": {
 *   "type": "http",
 *   "url": "https://example.com/mcp",
 *   "headers": {"Authorization": "Bearer ..."}
 * }
 * }</pre>
 *
 * @param type explicit transport name, may be {@code null}
 * @param command launch command for stdio servers
 * @param args launch arguments for stdio servers
 * @param env environment overlay for stdio servers
 * @param url endpoint URL for HTTP servers
 * @param headers request headers for HTTP servers
 * @author MCP Hub contributors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(@JsonProperty("type") String type, @JsonProperty("command") String command,
		@JsonProperty("args") List<String> args, @JsonProperty("env") Map<String, String> env,
		@JsonProperty("url") String url, @JsonProperty("headers") Map<String, String> headers) {

	public static ServerConfig stdio(String command, List<String> args, Map<String, String> env) {
		return new ServerConfig(null, command, args, env, null, null);
	}

	public static ServerConfig http(String url, Map<String, String> headers) {
		return new ServerConfig(null, null, null, null, url, headers);
	}

	/**
	 * Decide the transport. An explicit {@code type} wins; an unrecognized explicit type
	 * selects stdio. Without a type, a configured command selects stdio and everything
	 * else selects Streamable HTTP.
	 * @return the transport for this entry
	 */
	public TransportType transportType() {
		if (Utils.hasText(this.type)) {
			return TransportType.fromName(this.type).orElse(TransportType.STDIO);
		}
		return Utils.hasText(this.command) ? TransportType.STDIO : TransportType.STREAMABLE_HTTP;
	}

	/**
	 * Convert this entry into connection parameters.
	 * @param hostEnvironment the environment a spawned process inherits before the
	 * entry's own {@code env} is applied
	 * @return the parameters for the decided transport
	 */
	public ConnectionParams toConnectionParams(Map<String, String> hostEnvironment) {
		return switch (transportType()) {
			case STDIO -> new ConnectionParams.Stdio(this.command, this.args, this.env, hostEnvironment);
			case STREAMABLE_HTTP -> new ConnectionParams.StreamableHttp(this.url, this.headers);
		};
	}

}

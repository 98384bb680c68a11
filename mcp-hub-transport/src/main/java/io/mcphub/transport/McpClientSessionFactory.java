/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.transport;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcphub.session.BackendSession;
import io.mcphub.session.BackendSessionFactory;
import io.mcphub.session.ConnectionParams;
import io.mcphub.util.Assert;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens backend sessions with the MCP Java SDK: stdio backends through
 * {@link StdioClientTransport}, HTTP backends through
 * {@link HttpClientStreamableHttpTransport}. Each session gets its own
 * {@link McpSyncClient} identified as {@code mcp-client-<backend name>} and is
 * initialized before it is returned.
 *
 * @author MCP Hub contributors
 */
public class McpClientSessionFactory implements BackendSessionFactory {

	private static final Logger logger = LoggerFactory.getLogger(McpClientSessionFactory.class);

	public static final String CLIENT_NAME_PREFIX = "mcp-client-";

	public static final String CLIENT_VERSION = "1.0.0";

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

	private final Duration requestTimeout;

	private final Duration initializationTimeout;

	private final ObjectMapper objectMapper;

	McpClientSessionFactory(Duration requestTimeout, Duration initializationTimeout, ObjectMapper objectMapper) {
		this.requestTimeout = requestTimeout;
		this.initializationTimeout = initializationTimeout;
		this.objectMapper = objectMapper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public BackendSession open(String backendName, ConnectionParams params) {
		McpClientTransport transport = createTransport(params);
		McpSyncClient client = McpClient.sync(transport)
			.clientInfo(new McpSchema.Implementation(CLIENT_NAME_PREFIX + backendName, CLIENT_VERSION))
			.requestTimeout(this.requestTimeout)
			.initializationTimeout(this.initializationTimeout)
			.loggingConsumer(new BackendLoggingConsumer(backendName))
			.build();
		try {
			McpSchema.InitializeResult result = client.initialize();
			logger.debug("Backend '{}' initialized with protocol {}", backendName, result.protocolVersion());
		}
		catch (RuntimeException e) {
			try {
				client.close();
			}
			catch (RuntimeException closeError) {
				e.addSuppressed(closeError);
			}
			throw e;
		}
		return new McpClientBackendSession(backendName, client, this.objectMapper);
	}

	McpClientTransport createTransport(ConnectionParams params) {
		if (params instanceof ConnectionParams.Stdio stdio) {
			return new StdioClientTransport(serverParameters(stdio), this.objectMapper);
		}
		if (params instanceof ConnectionParams.StreamableHttp http) {
			URI uri = URI.create(http.url());
			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder();
			http.headers().forEach(requestBuilder::header);
			return HttpClientStreamableHttpTransport.builder(baseUrl(uri))
				.endpoint(endpoint(uri))
				.objectMapper(this.objectMapper)
				.requestBuilder(requestBuilder)
				.build();
		}
		throw new IllegalArgumentException("Unsupported connection params: " + params.getClass().getName());
	}

	/**
	 * @return launch parameters carrying the merged environment of {@code stdio}
	 */
	static ServerParameters serverParameters(ConnectionParams.Stdio stdio) {
		return ServerParameters.builder(stdio.command())
			.args(stdio.args())
			.env(stdio.mergedEnvironment())
			.build();
	}

	/**
	 * @return scheme and authority of the given URL
	 */
	static String baseUrl(URI uri) {
		return uri.getScheme() + "://" + uri.getRawAuthority();
	}

	/**
	 * @return path and query of the given URL, {@code /} when it has no path
	 */
	static String endpoint(URI uri) {
		String path = uri.getRawPath();
		StringBuilder endpoint = new StringBuilder((path == null || path.isEmpty()) ? "/" : path);
		if (uri.getRawQuery() != null) {
			endpoint.append('?').append(uri.getRawQuery());
		}
		return endpoint.toString();
	}

	/**
	 * Builder for {@link McpClientSessionFactory}.
	 */
	public static class Builder {

		private Duration requestTimeout = DEFAULT_TIMEOUT;

		private Duration initializationTimeout = DEFAULT_TIMEOUT;

		private ObjectMapper objectMapper;

		private Builder() {
		}

		/**
		 * Timeout applied by the SDK client to every request sent to a backend.
		 * @param requestTimeout the timeout
		 * @return this builder
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * Timeout for the initialize handshake performed when a session is opened.
		 * @param initializationTimeout the timeout
		 * @return this builder
		 */
		public Builder initializationTimeout(Duration initializationTimeout) {
			Assert.notNull(initializationTimeout, "Initialization timeout must not be null");
			this.initializationTimeout = initializationTimeout;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public McpClientSessionFactory build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new McpClientSessionFactory(this.requestTimeout, this.initializationTimeout, mapper);
		}

	}

}

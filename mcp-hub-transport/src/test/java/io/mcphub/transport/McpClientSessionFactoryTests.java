/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.transport;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpServer;
import io.mcphub.session.ConnectionParams;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpClientSessionFactory}.
 */
class McpClientSessionFactoryTests {

	private final McpClientSessionFactory factory = McpClientSessionFactory.builder()
		.requestTimeout(Duration.ofSeconds(2))
		.initializationTimeout(Duration.ofSeconds(2))
		.build();

	@Test
	void splitsUrlIntoBaseAndEndpoint() {
		URI uri = URI.create("https://api.example.com:8443/v1/mcp?tenant=a%20b");

		assertThat(McpClientSessionFactory.baseUrl(uri)).isEqualTo("https://api.example.com:8443");
		assertThat(McpClientSessionFactory.endpoint(uri)).isEqualTo("/v1/mcp?tenant=a%20b");
	}

	@Test
	void urlWithoutPathUsesRoot() {
		URI uri = URI.create("http://localhost:3000");

		assertThat(McpClientSessionFactory.baseUrl(uri)).isEqualTo("http://localhost:3000");
		assertThat(McpClientSessionFactory.endpoint(uri)).isEqualTo("/");
	}

	@Test
	void stdioParamsSelectStdioTransport() {
		ConnectionParams params = ConnectionParams.Stdio.of("npx", List.of("-y", "server"), Map.of("KEY", "v"));

		assertThat(factory.createTransport(params)).isInstanceOf(StdioClientTransport.class);
	}

	@Test
	void httpParamsSelectStreamableHttpTransport() {
		ConnectionParams params = new ConnectionParams.StreamableHttp("https://example.com/mcp",
				Map.of("Authorization", "Bearer token"));

		assertThat(factory.createTransport(params)).isInstanceOf(HttpClientStreamableHttpTransport.class);
	}

	@Test
	void stdioTransportLaunchesWithMergedEnvironment() {
		ConnectionParams.Stdio params = new ConnectionParams.Stdio("node", List.of("server.js", "--port", "0"),
				Map.of("LOG_LEVEL", "debug", "HOME", "/srv/backend"), Map.of("HOME", "/home/hub", "LANG", "C"));

		ServerParameters serverParameters = McpClientSessionFactory.serverParameters(params);

		assertThat(serverParameters.getCommand()).isEqualTo("node");
		assertThat(serverParameters.getArgs()).containsExactly("server.js", "--port", "0");
		assertThat(serverParameters.getEnv()).containsAllEntriesOf(params.mergedEnvironment())
			.containsEntry("HOME", "/srv/backend")
			.containsEntry("LANG", "C");
	}

	@Test
	@Timeout(30)
	void httpRequestsCarryConfiguredHeadersToTheEndpoint() throws IOException {
		List<String> requests = new CopyOnWriteArrayList<>();
		HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			try (InputStream body = exchange.getRequestBody()) {
				body.readAllBytes();
			}
			requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI() + " X-Api-Key="
					+ exchange.getRequestHeaders().getFirst("X-Api-Key"));
			exchange.sendResponseHeaders(500, -1);
			exchange.close();
		});
		server.start();
		try {
			String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/mcp?t=1";
			ConnectionParams params = new ConnectionParams.StreamableHttp(url, Map.of("X-Api-Key", "k1"));

			assertThatThrownBy(() -> factory.open("remote", params)).isInstanceOf(RuntimeException.class);

			assertThat(requests).isNotEmpty()
				.allSatisfy(request -> assertThat(request).endsWith(" /mcp?t=1 X-Api-Key=k1"))
				.anySatisfy(request -> assertThat(request).startsWith("POST "));
		}
		finally {
			server.stop(0);
		}
	}

	@Test
	@Timeout(30)
	void openFailsWhenProcessCannotStart() {
		ConnectionParams params = ConnectionParams.Stdio.of("mcp-hub-no-such-command-7f3a", List.of(), Map.of());

		assertThatThrownBy(() -> factory.open("missing", params)).isInstanceOf(RuntimeException.class);
	}

	@Test
	void builderRejectsNullTimeouts() {
		assertThatThrownBy(() -> McpClientSessionFactory.builder().requestTimeout(null))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> McpClientSessionFactory.builder().initializationTimeout(null))
			.isInstanceOf(IllegalArgumentException.class);
	}

}

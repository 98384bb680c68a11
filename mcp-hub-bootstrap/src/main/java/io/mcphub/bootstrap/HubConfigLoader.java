/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcphub.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link HubConfig server maps} from JSON text, local files or the remote blueprint
 * service.
 *
 * @author MCP Hub contributors
 */
public class HubConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(HubConfigLoader.class);

	public static final String DEFAULT_BLUEPRINT_ENDPOINT = "https://muxio.vercel.app/api/blueprint-servers";

	private final HttpClient httpClient;

	private final String blueprintEndpoint;

	private final Duration requestTimeout;

	private final ObjectMapper objectMapper;

	HubConfigLoader(HttpClient httpClient, String blueprintEndpoint, Duration requestTimeout,
			ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.blueprintEndpoint = blueprintEndpoint;
		this.requestTimeout = requestTimeout;
		this.objectMapper = objectMapper;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Parse a server map.
	 * @param json the JSON document
	 * @return the parsed map
	 * @throws HubConfigException if the document is malformed or has no
	 * {@code mcpServers} object
	 */
	public HubConfig parse(String json) {
		HubConfig config;
		try {
			config = this.objectMapper.readValue(json, HubConfig.class);
		}
		catch (JsonProcessingException e) {
			throw new HubConfigException("Invalid configuration format: " + e.getOriginalMessage(), e);
		}
		if (config == null || config.mcpServers() == null) {
			throw new HubConfigException("Invalid configuration format: missing mcpServers");
		}
		return config;
	}

	/**
	 * Read a server map from a local file.
	 * @param path the file to read
	 * @return the parsed map
	 * @throws HubConfigException if the file cannot be read or parsed
	 */
	public HubConfig load(Path path) {
		String json;
		try {
			json = Files.readString(path, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new HubConfigException("Failed to read configuration file '" + path + "': " + e.getMessage(), e);
		}
		return parse(json);
	}

	/**
	 * Fetch the server map of a blueprint from the blueprint service.
	 * @param blueprintId the blueprint id
	 * @return the parsed map
	 * @throws HubConfigException if the request fails, the service answers with a non-2xx
	 * status or the answer is not a valid server map
	 */
	public HubConfig fetchBlueprint(String blueprintId) {
		Assert.hasText(blueprintId, "Blueprint ID not specified.");
		URI uri = URI.create(this.blueprintEndpoint + "?blueprint_id="
				+ URLEncoder.encode(blueprintId, StandardCharsets.UTF_8));
		HttpRequest request = HttpRequest.newBuilder(uri)
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.timeout(this.requestTimeout)
			.GET()
			.build();
		try {
			HttpResponse<String> response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw new HubConfigException("HTTP error! status: " + response.statusCode());
			}
			return parse(response.body());
		}
		catch (IOException | HubConfigException e) {
			logger.error("Failed to fetch configuration from API: {}", e.getMessage());
			throw blueprintFailure(blueprintId, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw blueprintFailure(blueprintId, e);
		}
	}

	private static HubConfigException blueprintFailure(String blueprintId, Exception cause) {
		return new HubConfigException(
				"Failed to fetch configuration for blueprint '" + blueprintId + "': " + cause.getMessage(), cause);
	}

	/**
	 * Builder for {@link HubConfigLoader}.
	 */
	public static class Builder {

		private HttpClient httpClient;

		private String blueprintEndpoint = DEFAULT_BLUEPRINT_ENDPOINT;

		private Duration requestTimeout = Duration.ofSeconds(30);

		private ObjectMapper objectMapper;

		private Builder() {
		}

		public Builder httpClient(HttpClient httpClient) {
			Assert.notNull(httpClient, "HttpClient must not be null");
			this.httpClient = httpClient;
			return this;
		}

		/**
		 * The blueprint service endpoint; the blueprint id is appended as the
		 * {@code blueprint_id} query parameter.
		 * @param blueprintEndpoint the endpoint URL without query
		 * @return this builder
		 */
		public Builder blueprintEndpoint(String blueprintEndpoint) {
			Assert.hasText(blueprintEndpoint, "blueprintEndpoint must be a non-empty String");
			this.blueprintEndpoint = blueprintEndpoint;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public HubConfigLoader build() {
			HttpClient client = (this.httpClient != null) ? this.httpClient : HttpClient.newHttpClient();
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new HubConfigLoader(client, this.blueprintEndpoint, this.requestTimeout, mapper);
		}

	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcphub.catalog.CapabilitySummary;
import io.mcphub.catalog.CatalogAggregator;
import io.mcphub.catalog.SearchOutcome;
import io.mcphub.catalog.SearchSpec;
import io.mcphub.registry.BackendRegistry;
import io.mcphub.router.InvocationRouter;
import io.mcphub.session.BackendSessionFactory;
import io.mcphub.session.CapabilityDescriptor;
import io.mcphub.session.ConnectionParams;
import io.mcphub.session.ServerConfig;
import io.mcphub.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point to the hub: connects backends, enumerates and searches their
 * capabilities and routes invocations to them.
 *
 * <pre>{@code
 * McpHub hub = McpHub.builder(McpClientSessionFactory.builder().build())
 *     .hostEnvironment(System.getenv())
 *     .build();
 * hub.connect("files", ServerConfig.stdio("npx", List.of("-y", "@modelcontextprotocol/server-filesystem", "/tmp"), null));
 * Map<String, SearchOutcome> found = hub.search(SearchSpec.of("^read"));
 * JsonNode result = hub.invoke("files", "read_file", Map.of("path", "/tmp/notes.txt"));
 * hub.close();
 * }</pre>
 *
 * Every failure is reported as a {@link io.mcphub.error.HubException}.
 *
 * @author MCP Hub contributors
 */
public class McpHub implements AutoCloseable {

	private final BackendRegistry registry;

	private final CatalogAggregator catalog;

	private final InvocationRouter router;

	McpHub(BackendRegistry registry, CatalogAggregator catalog, InvocationRouter router) {
		this.registry = registry;
		this.catalog = catalog;
		this.router = router;
	}

	public static Builder builder(BackendSessionFactory sessionFactory) {
		return new Builder(sessionFactory);
	}

	public BackendRegistry registry() {
		return this.registry;
	}

	public void connect(String name, ConnectionParams params) {
		this.registry.connect(name, params);
	}

	public void connect(String name, ServerConfig config) {
		this.registry.connect(name, config);
	}

	public void disconnect(String name) {
		this.registry.disconnect(name);
	}

	public void disconnectAll() {
		this.registry.disconnectAll();
	}

	public List<String> listBackends() {
		return this.registry.listNames();
	}

	public List<CapabilityDescriptor> listCapabilities(String backendName) {
		return this.catalog.listCapabilities(backendName);
	}

	public List<CapabilitySummary> listCapabilitiesSummary(String backendName) {
		return this.catalog.listCapabilitiesSummary(backendName);
	}

	public CapabilityDescriptor getCapability(String backendName, String capabilityName) {
		return this.catalog.getCapability(backendName, capabilityName);
	}

	public List<CapabilitySummary> search(SearchSpec spec, String backendName) {
		return this.catalog.search(spec, backendName);
	}

	public Map<String, SearchOutcome> search(SearchSpec spec) {
		return this.catalog.search(spec);
	}

	public Mono<Map<String, SearchOutcome>> searchAsync(SearchSpec spec) {
		return this.catalog.searchAsync(spec);
	}

	public JsonNode invoke(String backendName, String capabilityName, Map<String, Object> arguments) {
		return this.router.invoke(backendName, capabilityName, arguments);
	}

	/**
	 * Disconnect every backend.
	 * @see BackendRegistry#disconnectAll()
	 */
	@Override
	public void close() {
		this.registry.disconnectAll();
	}

	/**
	 * Builder for {@link McpHub}.
	 */
	public static class Builder {

		private final BackendSessionFactory sessionFactory;

		private Map<String, String> hostEnvironment = Map.of();

		private Scheduler searchScheduler = Schedulers.boundedElastic();

		private int searchConcurrency = CatalogAggregator.DEFAULT_SEARCH_CONCURRENCY;

		private Builder(BackendSessionFactory sessionFactory) {
			Assert.notNull(sessionFactory, "Session factory must not be null");
			this.sessionFactory = sessionFactory;
		}

		/**
		 * Environment inherited by stdio backends connected from a {@link ServerConfig}.
		 * Empty by default; pass {@code System.getenv()} to inherit the JVM's
		 * environment.
		 * @param hostEnvironment the base environment
		 * @return this builder
		 */
		public Builder hostEnvironment(Map<String, String> hostEnvironment) {
			Assert.notNull(hostEnvironment, "Host environment must not be null");
			this.hostEnvironment = hostEnvironment;
			return this;
		}

		public Builder searchScheduler(Scheduler searchScheduler) {
			Assert.notNull(searchScheduler, "Scheduler must not be null");
			this.searchScheduler = searchScheduler;
			return this;
		}

		/**
		 * Maximum number of backends listed at once by a search across all backends.
		 * @param searchConcurrency a positive limit
		 * @return this builder
		 */
		public Builder searchConcurrency(int searchConcurrency) {
			Assert.isTrue(searchConcurrency > 0, "Search concurrency must be positive");
			this.searchConcurrency = searchConcurrency;
			return this;
		}

		public McpHub build() {
			BackendRegistry registry = new BackendRegistry(this.sessionFactory, this.hostEnvironment);
			return new McpHub(registry, new CatalogAggregator(registry, this.searchScheduler, this.searchConcurrency),
					new InvocationRouter(registry));
		}

	}

}

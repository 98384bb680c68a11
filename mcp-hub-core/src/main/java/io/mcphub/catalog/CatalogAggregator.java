/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.mcphub.error.HubErrorKind;
import io.mcphub.error.HubException;
import io.mcphub.registry.BackendRegistry;
import io.mcphub.session.BackendSession;
import io.mcphub.session.CapabilityDescriptor;
import io.mcphub.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Builds capability views over the sessions held by a {@link BackendRegistry}. Every
 * call queries the live sessions; nothing is cached.
 *
 * @author MCP Hub contributors
 */
public class CatalogAggregator {

	private static final Logger logger = LoggerFactory.getLogger(CatalogAggregator.class);

	public static final int DEFAULT_SEARCH_CONCURRENCY = 16;

	static final String SEARCH_FAILURE_PREFIX = "Failed to search capabilities: ";

	private final BackendRegistry registry;

	private final Scheduler scheduler;

	private final int searchConcurrency;

	public CatalogAggregator(BackendRegistry registry) {
		this(registry, Schedulers.boundedElastic(), DEFAULT_SEARCH_CONCURRENCY);
	}

	/**
	 * Create an aggregator.
	 * @param registry the registry to read sessions from
	 * @param scheduler the scheduler blocking listing calls of a multi-backend search run
	 * on
	 * @param searchConcurrency the maximum number of backends listed at once by a
	 * multi-backend search
	 */
	public CatalogAggregator(BackendRegistry registry, Scheduler scheduler, int searchConcurrency) {
		Assert.notNull(registry, "Registry must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.isTrue(searchConcurrency > 0, "Search concurrency must be positive");
		this.registry = registry;
		this.scheduler = scheduler;
		this.searchConcurrency = searchConcurrency;
	}

	/**
	 * List the capabilities of a backend exactly as it reports them.
	 * @param backendName the backend name
	 * @return the full descriptors
	 * @throws HubException {@code NOT_CONNECTED} or {@code LISTING_FAILED}
	 */
	public List<CapabilityDescriptor> listCapabilities(String backendName) {
		return this.registry.withSession(backendName, session -> fetch(backendName, session));
	}

	/**
	 * List the names and descriptions of a backend's capabilities. A backend reporting no
	 * capabilities yields an empty list.
	 * @param backendName the backend name
	 * @return the summaries in listing order
	 * @throws HubException {@code NOT_CONNECTED} or {@code LISTING_FAILED}
	 */
	public List<CapabilitySummary> listCapabilitiesSummary(String backendName) {
		return listCapabilities(backendName).stream()
			.filter(Objects::nonNull)
			.map(CapabilitySummary::of)
			.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * Find a capability by exact, case-sensitive name. If the backend reports the name
	 * more than once the first descriptor wins.
	 * @param backendName the backend name
	 * @param capabilityName the capability name
	 * @return the full descriptor
	 * @throws HubException {@code NOT_CONNECTED}, {@code LISTING_FAILED} or
	 * {@code CAPABILITY_NOT_FOUND}
	 */
	public CapabilityDescriptor getCapability(String backendName, String capabilityName) {
		return listCapabilities(backendName).stream()
			.filter(descriptor -> descriptor != null && Objects.equals(descriptor.name(), capabilityName))
			.findFirst()
			.orElseThrow(() -> HubException.capabilityNotFound(backendName, capabilityName));
	}

	/**
	 * Search the capabilities of a single backend.
	 * @param spec the search request
	 * @param backendName the backend to search
	 * @return the matching capabilities in listing order
	 * @throws HubException {@code INVALID_PATTERN} before any backend is queried,
	 * {@code NOT_CONNECTED} or {@code LISTING_FAILED}
	 */
	public List<CapabilitySummary> search(SearchSpec spec, String backendName) {
		Pattern pattern = spec.compile();
		return matching(listCapabilities(backendName), pattern, spec.scope());
	}

	/**
	 * Search the capabilities of every connected backend.
	 * @param spec the search request
	 * @return outcomes keyed by backend name in connect order
	 * @throws HubException {@code INVALID_PATTERN} before any backend is queried
	 * @see #searchAsync(SearchSpec)
	 */
	public Map<String, SearchOutcome> search(SearchSpec spec) {
		return searchAsync(spec).block();
	}

	/**
	 * Search the capabilities of every connected backend, listing up to the configured
	 * number of backends concurrently. Backends with no match are left out of the
	 * result. A backend whose listing fails is reported as {@link SearchOutcome.Failed}
	 * and does not affect the others. A backend disconnected while the search runs is
	 * left out.
	 * @param spec the search request
	 * @return a {@link Mono} emitting the outcomes keyed by backend name in connect order,
	 * or failing with {@code INVALID_PATTERN}
	 */
	public Mono<Map<String, SearchOutcome>> searchAsync(SearchSpec spec) {
		return Mono.defer(() -> {
			Pattern pattern = spec.compile();
			return Flux.fromIterable(this.registry.listNames())
				.flatMapSequential(name -> scan(name, pattern, spec.scope()), this.searchConcurrency)
				.collect(() -> new LinkedHashMap<String, SearchOutcome>(),
						(outcomes, entry) -> outcomes.put(entry.getKey(), entry.getValue()))
				.map(outcomes -> Collections.<String, SearchOutcome>unmodifiableMap(outcomes));
		});
	}

	private Mono<Map.Entry<String, SearchOutcome>> scan(String backendName, Pattern pattern, SearchScope scope) {
		return Mono.fromCallable(() -> matching(listCapabilities(backendName), pattern, scope))
			.subscribeOn(this.scheduler)
			.flatMap(matches -> matches.isEmpty() ? Mono.<Map.Entry<String, SearchOutcome>>empty()
					: Mono.just(Map.entry(backendName, (SearchOutcome) new SearchOutcome.Found(matches))))
			.onErrorResume(error -> {
				if (error instanceof HubException hubError && hubError.getKind() == HubErrorKind.NOT_CONNECTED) {
					logger.debug("Backend '{}' disconnected during search", backendName);
					return Mono.empty();
				}
				Throwable cause = (error instanceof HubException && error.getCause() != null) ? error.getCause()
						: error;
				logger.warn("Search of backend '{}' failed", backendName, error);
				SearchOutcome failed = new SearchOutcome.Failed(SEARCH_FAILURE_PREFIX + HubException.describe(cause));
				return Mono.just(Map.entry(backendName, failed));
			});
	}

	private static List<CapabilityDescriptor> fetch(String backendName, BackendSession session) {
		List<CapabilityDescriptor> listing;
		try {
			listing = session.listCapabilities();
		}
		catch (RuntimeException e) {
			throw HubException.listingFailed(backendName, e);
		}
		return (listing != null) ? Collections.unmodifiableList(new ArrayList<>(listing)) : List.of();
	}

	static List<CapabilitySummary> matching(List<CapabilityDescriptor> listing, Pattern pattern,
			SearchScope scope) {
		return listing.stream()
			.filter(descriptor -> descriptor != null && matches(descriptor, pattern, scope))
			.map(CapabilitySummary::of)
			.collect(Collectors.toUnmodifiableList());
	}

	private static boolean matches(CapabilityDescriptor descriptor, Pattern pattern, SearchScope scope) {
		boolean nameMatch = scope.includesName() && descriptor.name() != null
				&& pattern.matcher(descriptor.name()).find();
		boolean descriptionMatch = scope.includesDescription() && descriptor.description() != null
				&& pattern.matcher(descriptor.description()).find();
		return nameMatch || descriptionMatch;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.registry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

import io.mcphub.error.HubErrorKind;
import io.mcphub.error.HubException;
import io.mcphub.session.BackendSession;
import io.mcphub.session.BackendSessionFactory;
import io.mcphub.session.ConnectionParams;
import io.mcphub.session.ServerConfig;
import io.mcphub.util.Assert;
import io.mcphub.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the mapping from backend name to live {@link BackendSession} and mediates the
 * connect and disconnect lifecycle.
 *
 * <p>
 * Each name has its own read/write lock. {@link #connect} and {@link #disconnect} hold
 * the write lock for the whole transition, including the time spent opening or closing
 * the session. {@link #withSession} holds the read lock for the duration of its callback,
 * so reads on one name run concurrently with each other but never overlap a lifecycle
 * transition of that name. A read that starts after a disconnect has completed fails
 * with {@link HubErrorKind#NOT_CONNECTED}. Names never contend with each other.
 *
 * <p>
 * Backends are enumerated in the order they were connected.
 *
 * @author MCP Hub contributors
 */
public class BackendRegistry {

	private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

	private final BackendSessionFactory sessionFactory;

	private final Map<String, String> hostEnvironment;

	// Slots are never removed so that every thread agrees on the lock guarding a name.
	private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

	private final AtomicLong connectSequence = new AtomicLong();

	public BackendRegistry(BackendSessionFactory sessionFactory) {
		this(sessionFactory, Map.of());
	}

	/**
	 * Create a registry.
	 * @param sessionFactory opens sessions for validated parameters
	 * @param hostEnvironment environment inherited by stdio backends connected through
	 * {@link #connect(String, ServerConfig)}
	 */
	public BackendRegistry(BackendSessionFactory sessionFactory, Map<String, String> hostEnvironment) {
		Assert.notNull(sessionFactory, "Session factory must not be null");
		this.sessionFactory = sessionFactory;
		this.hostEnvironment = Utils.overlay(null, hostEnvironment);
	}

	/**
	 * Connect a backend described by a raw server entry. The transport is inferred by
	 * {@link ServerConfig#transportType()} and stdio backends inherit the registry's host
	 * environment.
	 * @param name the backend name
	 * @param config the server entry
	 * @see #connect(String, ConnectionParams)
	 */
	public void connect(String name, ServerConfig config) {
		Assert.notNull(config, "Server config must not be null");
		connect(name, config.toConnectionParams(this.hostEnvironment));
	}

	/**
	 * Open a session and register it under {@code name}. On any failure the registry is
	 * left unchanged.
	 * @param name the backend name
	 * @param params the connection parameters
	 * @throws HubException {@code ALREADY_CONNECTED}, {@code MISSING_COMMAND},
	 * {@code MISSING_URL}, {@code INVALID_URL} or {@code CONNECTION_FAILED}
	 */
	public void connect(String name, ConnectionParams params) {
		Assert.notNull(name, "Backend name must not be null");
		Assert.notNull(params, "Connection params must not be null");

		Slot slot = this.slots.computeIfAbsent(name, key -> new Slot());
		Lock lock = slot.lock.writeLock();
		lock.lock();
		try {
			if (slot.entry != null) {
				throw HubException.alreadyConnected(name);
			}
			validate(name, params);

			BackendSession session;
			try {
				session = this.sessionFactory.open(name, params);
			}
			catch (RuntimeException e) {
				logger.error("Failed to connect to backend '{}'", name, e);
				throw HubException.connectionFailed(name, e);
			}
			if (session == null) {
				throw HubException.connectionFailed(name, new IllegalStateException("Session factory returned null"));
			}

			slot.entry = new Entry(session, this.connectSequence.incrementAndGet());
			logger.info("Connected to backend '{}' over {}", name, params.transportType().configName());
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Close the session registered under {@code name} and remove it. The entry is
	 * removed even when closing fails.
	 * @param name the backend name
	 * @throws HubException {@code NOT_CONNECTED} or {@code DISCONNECT_FAILED}
	 */
	public void disconnect(String name) {
		Assert.notNull(name, "Backend name must not be null");
		Slot slot = this.slots.get(name);
		if (slot == null) {
			throw HubException.notConnected(name);
		}
		Lock lock = slot.lock.writeLock();
		lock.lock();
		try {
			Entry entry = slot.entry;
			if (entry == null) {
				throw HubException.notConnected(name);
			}
			slot.entry = null;
			try {
				entry.session().close();
			}
			catch (RuntimeException e) {
				logger.error("Failed to disconnect from backend '{}'", name, e);
				throw HubException.disconnectFailed(name, e);
			}
			logger.info("Disconnected from backend '{}'", name);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Disconnect every registered backend. Failures do not stop the remaining
	 * disconnects; they are reported together once all backends have been processed.
	 * @throws HubException {@code DISCONNECT_FAILED} with each individual failure attached
	 * as a suppressed exception
	 */
	public void disconnectAll() {
		List<HubException> failures = new ArrayList<>();
		for (String name : listNames()) {
			try {
				disconnect(name);
			}
			catch (HubException e) {
				if (e.getKind() == HubErrorKind.NOT_CONNECTED) {
					logger.debug("Backend '{}' was disconnected concurrently", name);
				}
				else {
					failures.add(e);
				}
			}
		}
		if (!failures.isEmpty()) {
			String detail = failures.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
			HubException aggregate = new HubException(HubErrorKind.DISCONNECT_FAILED, null,
					"Failed to disconnect " + failures.size() + " backend(s): " + detail);
			failures.forEach(aggregate::addSuppressed);
			throw aggregate;
		}
	}

	/**
	 * @return the connected backend names in connect order
	 */
	public List<String> listNames() {
		List<Map.Entry<String, Long>> connected = new ArrayList<>();
		this.slots.forEach((name, slot) -> {
			Entry entry = slot.entry;
			if (entry != null) {
				connected.add(Map.entry(name, entry.order()));
			}
		});
		connected.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
		return connected.stream().map(Map.Entry::getKey).collect(Collectors.toUnmodifiableList());
	}

	public boolean isConnected(String name) {
		if (name == null) {
			return false;
		}
		Slot slot = this.slots.get(name);
		return slot != null && slot.entry != null;
	}

	/**
	 * Look up the session of a connected backend. The returned reference is not guarded
	 * against a concurrent disconnect; prefer {@link #withSession} for round trips.
	 * @param name the backend name
	 * @return the live session
	 * @throws HubException {@code NOT_CONNECTED}
	 */
	public BackendSession get(String name) {
		return withSession(name, Function.identity());
	}

	/**
	 * Run {@code callback} against the session of a connected backend while holding the
	 * name's read lock. The callback must not connect or disconnect the same name.
	 * @param name the backend name
	 * @param callback the work to run with the session
	 * @return the callback's result
	 * @throws HubException {@code NOT_CONNECTED}; exceptions thrown by the callback
	 * propagate unchanged
	 */
	public <T> T withSession(String name, Function<BackendSession, T> callback) {
		Assert.notNull(name, "Backend name must not be null");
		Assert.notNull(callback, "Callback must not be null");
		Slot slot = this.slots.get(name);
		if (slot == null) {
			throw HubException.notConnected(name);
		}
		Lock lock = slot.lock.readLock();
		lock.lock();
		try {
			Entry entry = slot.entry;
			if (entry == null) {
				throw HubException.notConnected(name);
			}
			return callback.apply(entry.session());
		}
		finally {
			lock.unlock();
		}
	}

	private static void validate(String name, ConnectionParams params) {
		if (params instanceof ConnectionParams.Stdio stdio) {
			if (!Utils.hasText(stdio.command())) {
				throw HubException.missingCommand(name);
			}
		}
		else if (params instanceof ConnectionParams.StreamableHttp http) {
			if (!Utils.hasText(http.url())) {
				throw HubException.missingUrl(name);
			}
			try {
				URI uri = new URI(http.url());
				if (!uri.isAbsolute() || uri.isOpaque()) {
					throw HubException.invalidUrl(name, http.url(), null);
				}
			}
			catch (URISyntaxException e) {
				throw HubException.invalidUrl(name, http.url(), e);
			}
		}
	}

	private static final class Slot {

		private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

		private volatile Entry entry;

	}

	private record Entry(BackendSession session, long order) {
	}

}

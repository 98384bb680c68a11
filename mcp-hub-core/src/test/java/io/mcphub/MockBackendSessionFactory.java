/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.mcphub.session.BackendSession;
import io.mcphub.session.BackendSessionFactory;
import io.mcphub.session.ConnectionParams;

/**
 * {@link BackendSessionFactory} handing out {@link MockBackendSession}s. A session can be
 * prepared before the backend is connected; otherwise a fresh one is created on open.
 */
public class MockBackendSessionFactory implements BackendSessionFactory {

	private final Map<String, MockBackendSession> prepared = new ConcurrentHashMap<>();

	private final Map<String, MockBackendSession> opened = new ConcurrentHashMap<>();

	private final Map<String, RuntimeException> openFailures = new ConcurrentHashMap<>();

	private final List<ConnectionParams> openedParams = new CopyOnWriteArrayList<>();

	/**
	 * @return the session the next successful open of {@code name} returns
	 */
	public MockBackendSession prepare(String name) {
		return this.prepared.computeIfAbsent(name, key -> new MockBackendSession());
	}

	public void failOpen(String name, RuntimeException failure) {
		this.openFailures.put(name, failure);
	}

	public void recover(String name) {
		this.openFailures.remove(name);
	}

	@Override
	public BackendSession open(String backendName, ConnectionParams params) {
		this.openedParams.add(params);
		RuntimeException failure = this.openFailures.get(backendName);
		if (failure != null) {
			throw failure;
		}
		MockBackendSession session = this.prepared.remove(backendName);
		if (session == null) {
			session = new MockBackendSession();
		}
		this.opened.put(backendName, session);
		return session;
	}

	/**
	 * @return the session most recently opened for {@code name}
	 */
	public MockBackendSession session(String name) {
		return this.opened.get(name);
	}

	public List<ConnectionParams> getOpenedParams() {
		return this.openedParams;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcphub.session.BackendSession;
import io.mcphub.session.CapabilityDescriptor;

/**
 * In-memory {@link BackendSession} whose listing, invocation and close behavior is set
 * by the test.
 */
public class MockBackendSession implements BackendSession {

	private volatile List<CapabilityDescriptor> capabilities = List.of();

	private volatile RuntimeException listFailure;

	private volatile RuntimeException closeFailure;

	private volatile Runnable beforeListing = () -> {
	};

	private volatile Function<Invocation, JsonNode> responder = MockBackendSession::echo;

	private final AtomicInteger listCalls = new AtomicInteger();

	private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

	private volatile boolean closed;

	public static CapabilityDescriptor capability(String name, String description) {
		ObjectNode schema = JsonNodeFactory.instance.objectNode();
		schema.put("type", "object");
		schema.putObject("properties").putObject("path").put("type", "string");
		return new CapabilityDescriptor(name, description, schema);
	}

	public MockBackendSession withCapabilities(CapabilityDescriptor... capabilities) {
		this.capabilities = new ArrayList<>(Arrays.asList(capabilities));
		return this;
	}

	public MockBackendSession withCapabilities(List<CapabilityDescriptor> capabilities) {
		this.capabilities = capabilities;
		return this;
	}

	public MockBackendSession failListingWith(RuntimeException failure) {
		this.listFailure = failure;
		return this;
	}

	/**
	 * Run {@code action} on the calling thread at the start of every listing, for
	 * example to hold the caller on a latch.
	 */
	public MockBackendSession beforeListing(Runnable action) {
		this.beforeListing = action;
		return this;
	}

	public MockBackendSession failCloseWith(RuntimeException failure) {
		this.closeFailure = failure;
		return this;
	}

	public MockBackendSession respondWith(Function<Invocation, JsonNode> responder) {
		this.responder = responder;
		return this;
	}

	@Override
	public List<CapabilityDescriptor> listCapabilities() {
		this.listCalls.incrementAndGet();
		this.beforeListing.run();
		if (this.listFailure != null) {
			throw this.listFailure;
		}
		return this.capabilities;
	}

	@Override
	public JsonNode invoke(String capabilityName, Map<String, Object> arguments) {
		Invocation invocation = new Invocation(capabilityName, arguments);
		this.invocations.add(invocation);
		return this.responder.apply(invocation);
	}

	@Override
	public void close() {
		this.closed = true;
		if (this.closeFailure != null) {
			throw this.closeFailure;
		}
	}

	public int getListCalls() {
		return this.listCalls.get();
	}

	public List<Invocation> getInvocations() {
		return this.invocations;
	}

	public boolean isClosed() {
		return this.closed;
	}

	private static JsonNode echo(Invocation invocation) {
		ObjectNode result = JsonNodeFactory.instance.objectNode();
		result.put("tool", invocation.name());
		result.putPOJO("arguments", invocation.arguments());
		return result;
	}

	public record Invocation(String name, Map<String, Object> arguments) {
	}

}

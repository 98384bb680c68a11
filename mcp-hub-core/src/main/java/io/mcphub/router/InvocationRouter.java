/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.router;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcphub.error.HubException;
import io.mcphub.registry.BackendRegistry;
import io.mcphub.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards capability invocations to the session of the named backend. Arguments and
 * results pass through untouched; there is no retry and no timeout of its own.
 *
 * @author MCP Hub contributors
 */
public class InvocationRouter {

	private static final Logger logger = LoggerFactory.getLogger(InvocationRouter.class);

	private final BackendRegistry registry;

	public InvocationRouter(BackendRegistry registry) {
		Assert.notNull(registry, "Registry must not be null");
		this.registry = registry;
	}

	/**
	 * Invoke a capability on a connected backend.
	 * @param backendName the backend name
	 * @param capabilityName the capability to call
	 * @param arguments the call arguments, {@code null} is sent as an empty map
	 * @return the backend's result payload
	 * @throws HubException {@code NOT_CONNECTED} or {@code INVOCATION_FAILED}
	 */
	public JsonNode invoke(String backendName, String capabilityName, Map<String, Object> arguments) {
		Assert.notNull(capabilityName, "Capability name must not be null");
		Map<String, Object> args = (arguments != null) ? arguments : Map.of();
		return this.registry.withSession(backendName, session -> {
			try {
				return session.invoke(capabilityName, args);
			}
			catch (RuntimeException e) {
				logger.warn("Call of tool '{}' on backend '{}' failed", capabilityName, backendName, e);
				throw HubException.invocationFailed(backendName, capabilityName, e);
			}
		});
	}

}

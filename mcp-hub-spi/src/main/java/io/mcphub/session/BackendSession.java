/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A live connection to one backend server. Implementations hide the transport; failures
 * of any operation are reported as unchecked exceptions whose message carries the
 * original transport or process error text.
 *
 * <p>
 * A session is owned by exactly one registry entry. Operations may be called
 * concurrently with each other but never concurrently with {@link #close()}.
 *
 * @author MCP Hub contributors
 */
public interface BackendSession extends AutoCloseable {

	/**
	 * Query the backend for its current capabilities. Never cached.
	 * @return the capabilities in the order the backend reported them
	 */
	List<CapabilityDescriptor> listCapabilities();

	/**
	 * Invoke a capability.
	 * @param capabilityName the capability to call
	 * @param arguments arbitrary arguments, forwarded unvalidated
	 * @return the backend's result payload
	 */
	JsonNode invoke(String capabilityName, Map<String, Object> arguments);

	/**
	 * Close the session and release the underlying transport.
	 */
	@Override
	void close();

}

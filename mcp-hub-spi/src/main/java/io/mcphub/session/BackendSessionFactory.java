/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

/**
 * Opens {@link BackendSession sessions} for validated connection parameters.
 *
 * @author MCP Hub contributors
 */
@FunctionalInterface
public interface BackendSessionFactory {

	/**
	 * Open a session, completing the transport handshake before returning.
	 * @param backendName the name the session will be registered under
	 * @param params the connection parameters, already validated by the caller
	 * @return an open session
	 * @throws RuntimeException if the process fails to start, the connection cannot be
	 * established or the handshake fails
	 */
	BackendSession open(String backendName, ConnectionParams params);

}

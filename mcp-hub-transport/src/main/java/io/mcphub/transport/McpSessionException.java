/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.transport;

/**
 * Failure of an MCP client session that the SDK reports by return value rather than by
 * exception.
 */
public class McpSessionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public McpSessionException(String message) {
		super(message);
	}

	public McpSessionException(String message, Throwable cause) {
		super(message, cause);
	}

}

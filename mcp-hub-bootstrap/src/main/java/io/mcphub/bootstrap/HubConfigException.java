/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.bootstrap;

/**
 * A server map could not be read, fetched or parsed.
 */
public class HubConfigException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public HubConfigException(String message) {
		super(message);
	}

	public HubConfigException(String message, Throwable cause) {
		super(message, cause);
	}

}

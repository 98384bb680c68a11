/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.error;

/**
 * The failure kinds a hub operation can surface.
 */
public enum HubErrorKind {

	ALREADY_CONNECTED,

	NOT_CONNECTED,

	MISSING_COMMAND,

	MISSING_URL,

	INVALID_URL,

	/**
	 * The session could not be opened. Carries the transport or process failure.
	 */
	CONNECTION_FAILED,

	/**
	 * The session did not close cleanly. The registry entry is removed regardless.
	 */
	DISCONNECT_FAILED,

	INVALID_PATTERN,

	CAPABILITY_NOT_FOUND,

	/**
	 * The backend failed to answer a capability listing.
	 */
	LISTING_FAILED,

	INVOCATION_FAILED

}

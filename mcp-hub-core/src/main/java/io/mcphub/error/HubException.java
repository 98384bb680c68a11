/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.error;

import reactor.util.annotation.Nullable;

/**
 * Failure of a registry, catalog or routing operation. The {@link #getKind() kind}
 * identifies what went wrong; when a backend or transport failure is involved the
 * original exception is kept as the cause and its message is part of this exception's
 * message.
 *
 * @author MCP Hub contributors
 */
public class HubException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final HubErrorKind kind;

	@Nullable
	private final String backendName;

	public HubException(HubErrorKind kind, @Nullable String backendName, String message) {
		this(kind, backendName, message, null);
	}

	public HubException(HubErrorKind kind, @Nullable String backendName, String message,
			@Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.backendName = backendName;
	}

	public HubErrorKind getKind() {
		return this.kind;
	}

	/**
	 * @return the backend the failure relates to, or {@code null} when the failure is not
	 * tied to a single backend
	 */
	@Nullable
	public String getBackendName() {
		return this.backendName;
	}

	public static HubException alreadyConnected(String backendName) {
		return new HubException(HubErrorKind.ALREADY_CONNECTED, backendName,
				"Already connected to backend '" + backendName + "'.");
	}

	public static HubException notConnected(String backendName) {
		return new HubException(HubErrorKind.NOT_CONNECTED, backendName,
				"Not connected to backend '" + backendName + "'.");
	}

	public static HubException missingCommand(String backendName) {
		return new HubException(HubErrorKind.MISSING_COMMAND, backendName,
				"Stdio backend '" + backendName + "' requires a command.");
	}

	public static HubException missingUrl(String backendName) {
		return new HubException(HubErrorKind.MISSING_URL, backendName,
				"HTTP backend '" + backendName + "' requires a URL.");
	}

	public static HubException invalidUrl(String backendName, String url, @Nullable Throwable cause) {
		return new HubException(HubErrorKind.INVALID_URL, backendName,
				"HTTP backend '" + backendName + "' has an invalid URL: " + url, cause);
	}

	public static HubException connectionFailed(String backendName, Throwable cause) {
		return new HubException(HubErrorKind.CONNECTION_FAILED, backendName,
				"Failed to connect to backend '" + backendName + "': " + describe(cause), cause);
	}

	public static HubException disconnectFailed(String backendName, Throwable cause) {
		return new HubException(HubErrorKind.DISCONNECT_FAILED, backendName,
				"Failed to disconnect from backend '" + backendName + "': " + describe(cause), cause);
	}

	public static HubException invalidPattern(String pattern, Throwable cause) {
		return new HubException(HubErrorKind.INVALID_PATTERN, null,
				"Invalid regex pattern '" + pattern + "': " + describe(cause), cause);
	}

	public static HubException capabilityNotFound(String backendName, String capabilityName) {
		return new HubException(HubErrorKind.CAPABILITY_NOT_FOUND, backendName,
				"Tool '" + capabilityName + "' not found on backend '" + backendName + "'");
	}

	public static HubException listingFailed(String backendName, Throwable cause) {
		return new HubException(HubErrorKind.LISTING_FAILED, backendName,
				"Failed to list tools of backend '" + backendName + "': " + describe(cause), cause);
	}

	public static HubException invocationFailed(String backendName, String capabilityName, Throwable cause) {
		return new HubException(HubErrorKind.INVOCATION_FAILED, backendName,
				"Failed to call tool '" + capabilityName + "' on backend '" + backendName + "': " + describe(cause),
				cause);
	}

	/**
	 * Message of the given throwable, falling back to its type when it has none.
	 * @param cause the failure to describe
	 * @return a non-null description
	 */
	public static String describe(Throwable cause) {
		String message = cause.getMessage();
		return (message != null) ? message : cause.getClass().getName();
	}

}

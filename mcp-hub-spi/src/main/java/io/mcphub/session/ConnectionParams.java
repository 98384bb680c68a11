/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.mcphub.util.Utils;

/**
 * Transport-specific parameters used to open a {@link BackendSession}. The set of
 * variants is closed: a new transport is added as a new record here and a new branch in
 * each {@link BackendSessionFactory}.
 *
 * <p>
 * The records accept incomplete values on purpose. A missing command or URL is reported
 * by the registry when the connection is attempted, not when the parameters are built.
 *
 * @author MCP Hub contributors
 */
public sealed interface ConnectionParams permits ConnectionParams.Stdio, ConnectionParams.StreamableHttp {

	/**
	 * @return the transport this variant selects
	 */
	TransportType transportType();

	/**
	 * Parameters for a backend launched as a child process.
	 *
	 * @param command the executable to launch
	 * @param args the ordered launch arguments
	 * @param env environment overlay applied on top of {@code baseEnvironment}
	 * @param baseEnvironment the host environment the child inherits, passed explicitly
	 * rather than read from the running JVM
	 */
	record Stdio(String command, List<String> args, Map<String, String> env,
			Map<String, String> baseEnvironment) implements ConnectionParams {

		public Stdio {
			args = (args == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
			env = Utils.overlay(null, env);
			baseEnvironment = Utils.overlay(null, baseEnvironment);
		}

		/**
		 * Create stdio parameters with an empty base environment.
		 * @param command the executable to launch
		 * @param args the launch arguments, may be {@code null}
		 * @param env the environment overlay, may be {@code null}
		 * @return the parameters
		 */
		public static Stdio of(String command, List<String> args, Map<String, String> env) {
			return new Stdio(command, args, env, Map.of());
		}

		/**
		 * @return a copy of these parameters inheriting the given host environment
		 */
		public Stdio withBaseEnvironment(Map<String, String> baseEnvironment) {
			return new Stdio(this.command, this.args, this.env, baseEnvironment);
		}

		/**
		 * The environment the child process is launched with: the base environment with
		 * the overlay applied last, so the overlay wins on conflicting names.
		 * @return the merged environment
		 */
		public Map<String, String> mergedEnvironment() {
			return Utils.overlay(this.baseEnvironment, this.env);
		}

		@Override
		public TransportType transportType() {
			return TransportType.STDIO;
		}

	}

	/**
	 * Parameters for a backend reached over Streamable HTTP.
	 *
	 * @param url the absolute endpoint URL
	 * @param headers headers attached to every outbound request
	 */
	record StreamableHttp(String url, Map<String, String> headers) implements ConnectionParams {

		public StreamableHttp {
			headers = Utils.overlay(null, headers);
		}

		public static StreamableHttp of(String url) {
			return new StreamableHttp(url, Map.of());
		}

		@Override
		public TransportType transportType() {
			return TransportType.STREAMABLE_HTTP;
		}

	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.transport;

import java.util.function.Consumer;

import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.LoggingMessageNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Forwards log notifications sent by a backend server to SLF4J, tagged with the
 * backend's name.
 *
 * @author MCP Hub contributors
 */
public class BackendLoggingConsumer implements Consumer<McpSchema.LoggingMessageNotification> {

	private static final Logger logger = LoggerFactory.getLogger(BackendLoggingConsumer.class);

	private final String backendName;

	public BackendLoggingConsumer(String backendName) {
		this.backendName = backendName;
	}

	@Override
	public void accept(LoggingMessageNotification notification) {
		logger.atLevel(convert(notification.level()))
			.setMessage("[{}] {}: {}")
			.addArgument(this.backendName)
			.addArgument(notification.logger() != null ? notification.logger() : "server")
			.addArgument(notification.data())
			.log();
	}

	static Level convert(McpSchema.LoggingLevel level) {
		if (level == null) {
			return Level.INFO;
		}
		return switch (level) {
			case DEBUG -> Level.DEBUG;
			case INFO, NOTICE -> Level.INFO;
			case WARNING -> Level.WARN;
			case ERROR, CRITICAL, ALERT, EMERGENCY -> Level.ERROR;
		};
	}

}

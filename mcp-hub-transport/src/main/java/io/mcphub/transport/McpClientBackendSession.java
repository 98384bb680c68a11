/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcphub.session.BackendSession;
import io.mcphub.session.CapabilityDescriptor;
import io.mcphub.util.Utils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackendSession} over an initialized {@link McpSyncClient}. Tools map to
 * capabilities; schemas and call results are converted to JSON trees without
 * interpretation.
 *
 * @author MCP Hub contributors
 */
public class McpClientBackendSession implements BackendSession {

	private static final Logger logger = LoggerFactory.getLogger(McpClientBackendSession.class);

	private final String backendName;

	private final McpSyncClient client;

	private final ObjectMapper objectMapper;

	public McpClientBackendSession(String backendName, McpSyncClient client, ObjectMapper objectMapper) {
		this.backendName = backendName;
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * List all tools, following {@code nextCursor} until the server stops returning one.
	 */
	@Override
	public List<CapabilityDescriptor> listCapabilities() {
		List<CapabilityDescriptor> capabilities = new ArrayList<>();
		Set<String> seenCursors = new HashSet<>();
		McpSchema.ListToolsResult page = this.client.listTools();
		while (page != null) {
			if (page.tools() != null) {
				for (McpSchema.Tool tool : page.tools()) {
					capabilities.add(toDescriptor(tool));
				}
			}
			String cursor = page.nextCursor();
			if (!Utils.hasText(cursor)) {
				break;
			}
			if (!seenCursors.add(cursor)) {
				logger.warn("Backend '{}' repeated list cursor '{}', stopping pagination", this.backendName, cursor);
				break;
			}
			page = this.client.listTools(cursor);
		}
		return Collections.unmodifiableList(capabilities);
	}

	@Override
	public JsonNode invoke(String capabilityName, Map<String, Object> arguments) {
		McpSchema.CallToolResult result = this.client.callTool(new McpSchema.CallToolRequest(capabilityName, arguments));
		return this.objectMapper.valueToTree(result);
	}

	@Override
	public void close() {
		if (!this.client.closeGracefully()) {
			this.client.close();
			throw new McpSessionException("Backend '" + this.backendName + "' did not shut down gracefully");
		}
	}

	private CapabilityDescriptor toDescriptor(McpSchema.Tool tool) {
		JsonNode inputSchema = (tool.inputSchema() != null) ? this.objectMapper.valueToTree(tool.inputSchema())
				: null;
		return new CapabilityDescriptor(tool.name(), tool.description(), inputSchema);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A capability (tool) as reported by a backend at the time of listing.
 *
 * @param name the capability name, unique within its backend only
 * @param description human-readable description, may be {@code null}
 * @param inputSchema the input schema exactly as the backend reported it, may be
 * {@code null}
 */
public record CapabilityDescriptor(String name, String description, JsonNode inputSchema) {
}

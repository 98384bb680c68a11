/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.catalog;

import io.mcphub.session.CapabilityDescriptor;

/**
 * Name and description of a capability, without its input schema.
 *
 * @param name the capability name
 * @param description the description, may be {@code null}
 */
public record CapabilitySummary(String name, String description) {

	public static CapabilitySummary of(CapabilityDescriptor descriptor) {
		return new CapabilitySummary(descriptor.name(), descriptor.description());
	}

}

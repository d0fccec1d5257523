package io.routeweave.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An administrator-defined middleware. {@code config} is the opaque body
 * placed under {@code type} in the published document.
 */
public record MiddlewareRecord(String id, String name, String type, JsonNode config) {}

package com.warden.controlplane.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request context. Takes precedence over {@link ContextV1} field by field.
 *
 * @param projectId project id
 * @param provider provider name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextV2(@JsonProperty("project_id") String projectId, String provider) {}

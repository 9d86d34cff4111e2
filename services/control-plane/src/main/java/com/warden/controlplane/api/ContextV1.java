package com.warden.controlplane.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Legacy request context.
 *
 * @param project project id
 * @param provider provider name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextV1(String project, String provider) {}

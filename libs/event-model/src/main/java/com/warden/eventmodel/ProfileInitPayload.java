package com.warden.eventmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of {@link EventTopic#PROFILE_INITIALISED}: tells the reconciler to
 * evaluate every entity of the provider in the project against its profiles.
 *
 * @param provider  provider name
 * @param projectId project id
 */
public record ProfileInitPayload(
        @JsonProperty("provider") String provider,
        @JsonProperty("project_id") String projectId) {}

package com.warden.controlplane.domain.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Aggregate evaluation status of one profile. */
public record ProfileStatusView(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("profile_name") String profileName,
        @JsonProperty("profile_status") String status,
        @JsonProperty("last_updated") Instant lastUpdated) {}

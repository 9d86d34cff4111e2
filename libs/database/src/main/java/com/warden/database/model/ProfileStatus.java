package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/** Aggregate evaluation status of a profile. */
public record ProfileStatus(UUID profileId, String profileName, String status, Instant lastUpdated) {}

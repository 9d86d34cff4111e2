package com.warden.database.model;

import java.time.Instant;
import java.util.UUID;

/** A user enrolled through the identity provider, keyed by token subject. */
public record User(UUID id, String subject, String displayName, Instant createdAt) {}

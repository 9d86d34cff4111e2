package com.warden.controlplane.api;

/** A message without fields, encoded as {@code {}}. */
public record Empty() {

    public static final Empty INSTANCE = new Empty();
}

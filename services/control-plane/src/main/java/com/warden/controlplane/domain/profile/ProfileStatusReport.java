package com.warden.controlplane.domain.profile;

import java.util.List;

/** A profile's aggregate status with its per-rule evaluations. */
public record ProfileStatusReport(
        ProfileStatusView profile, List<RuleEvaluationView> evaluations) {}

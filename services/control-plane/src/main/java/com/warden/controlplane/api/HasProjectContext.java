package com.warden.controlplane.api;

import com.warden.controlplane.domain.ContextSelector;

/** A request message that names the project and provider it acts on. */
public interface HasProjectContext {

    ContextV1 context();

    ContextV2 contextV2();

    default ContextSelector selector() {
        ContextV1 v1 = context();
        ContextV2 v2 = contextV2();
        return new ContextSelector(
                v1 == null ? null : new ContextSelector.Requested(v1.project(), v1.provider()),
                v2 == null ? null : new ContextSelector.Requested(v2.projectId(), v2.provider()));
    }
}

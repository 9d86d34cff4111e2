package com.warden.controlplane.api.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.controlplane.api.ContextV1;
import com.warden.controlplane.api.ContextV2;
import com.warden.controlplane.api.HasProjectContext;
import com.warden.database.model.Provider;
import java.time.Instant;
import java.util.List;

/** Request and response messages of {@code warden.v1.ProviderService}. */
public final class ProviderMessages {

    private ProviderMessages() {}

    public record ListProvidersRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2)
            implements HasProjectContext {}

    public record ListProvidersResponse(
            @JsonProperty("providers") List<ProviderRecord> providers) {}

    public record GetProviderRequest(
            @JsonProperty("context") ContextV1 context,
            @JsonProperty("context_v2") ContextV2 contextV2,
            @JsonProperty("name") String name)
            implements HasProjectContext {}

    public record GetProviderResponse(@JsonProperty("provider") ProviderRecord provider) {}

    /** @param implementsTraits capabilities of the provider, e.g. {@code git} */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProviderRecord(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("project") String project,
            @JsonProperty("class") String providerClass,
            @JsonProperty("implements") List<String> implementsTraits,
            @JsonProperty("version") String version,
            @JsonProperty("created_at") Instant createdAt) {

        static ProviderRecord of(Provider provider) {
            return new ProviderRecord(
                    provider.id().toString(),
                    provider.name(),
                    provider.projectId().toString(),
                    provider.providerClass(),
                    provider.traits(),
                    provider.version(),
                    provider.createdAt());
        }
    }
}

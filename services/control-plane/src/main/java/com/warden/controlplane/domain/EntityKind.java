package com.warden.controlplane.domain;

import com.warden.database.model.RuleEvaluation;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Classes of objects a rule can be evaluated against.
 *
 * <p>Each kind carries its wire name ({@link #value()}, decoded by {@link #fromString(String)})
 * and the way an evaluation row of that kind is described to callers ({@link
 * #describe(RuleEvaluation, String)}).
 */
public enum EntityKind {
    REPOSITORY("repository") {
        @Override
        void enrich(RuleEvaluation row, Map<String, String> info) {
            putRepository(row, info);
        }
    },
    ARTIFACT("artifact") {
        @Override
        void enrich(RuleEvaluation row, Map<String, String> info) {
            putRepository(row, info);
            if (row.entityId() != null) {
                info.put("artifact_id", row.entityId().toString());
            }
            putIfSet(info, "artifact_name", row.artifactName());
            putIfSet(info, "artifact_type", row.artifactType());
        }
    },
    BUILD_ENVIRONMENT("build_environment") {
        @Override
        void enrich(RuleEvaluation row, Map<String, String> info) {}
    },
    PULL_REQUEST("pull_request") {
        @Override
        void enrich(RuleEvaluation row, Map<String, String> info) {
            putRepository(row, info);
        }
    };

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    /** The wire and storage name, e.g. "build_environment". */
    public String value() {
        return value;
    }

    abstract void enrich(RuleEvaluation row, Map<String, String> info);

    /**
     * Entity information shown next to an evaluation result.
     *
     * @param row the evaluation row with its joined entity columns
     * @param fallbackProvider provider name used when the row has none
     */
    public Map<String, String> describe(RuleEvaluation row, String fallbackProvider) {
        Map<String, String> info = new LinkedHashMap<>();
        String provider = row.provider() != null ? row.provider() : fallbackProvider;
        putIfSet(info, "provider", provider);
        enrich(row, info);
        return info;
    }

    public static Optional<EntityKind> fromString(String value) {
        for (EntityKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /** Comma-separated wire names, for error messages. */
    public static String knownValues() {
        return Arrays.stream(values()).map(EntityKind::value).collect(Collectors.joining(", "));
    }

    private static void putRepository(RuleEvaluation row, Map<String, String> info) {
        if (row.repoName() == null) {
            return;
        }
        putIfSet(info, "repo_owner", row.repoOwner());
        info.put("repo_name", row.repoName());
        if (row.repoId() != null) {
            info.put("repository_id", row.repoId().toString());
        }
    }

    private static void putIfSet(Map<String, String> info, String key, String value) {
        if (value != null) {
            info.put(key, value);
        }
    }
}

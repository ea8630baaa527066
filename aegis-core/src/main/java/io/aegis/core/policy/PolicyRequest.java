package io.aegis.core.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record PolicyRequest(
    String userId,
    String toolName,
    Map<String, String> parameters,
    RequestedLimits resourceLimits,
    boolean containsSecrets,
    boolean networkAccess,
    List<String> filePaths,
    RiskLevel riskAssessment
) {

    public PolicyRequest {
        userId = userId == null || userId.isBlank() ? null : userId.trim();
        toolName = toolName == null ? "" : toolName.trim();
        parameters = withoutNulls(parameters);
        resourceLimits = resourceLimits == null ? RequestedLimits.defaults() : resourceLimits;
        filePaths = filePaths == null ? List.of() : filePaths.stream().filter(Objects::nonNull).toList();
        riskAssessment = riskAssessment == null ? RiskLevel.MEDIUM : riskAssessment;
    }

    public static Builder builder(String toolName) {
        return new Builder(toolName);
    }

    // Entries with a null key or value carry nothing a condition could match.
    private static Map<String, String> withoutNulls(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final String toolName;
        private String userId;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private RequestedLimits resourceLimits = RequestedLimits.defaults();
        private boolean containsSecrets;
        private boolean networkAccess;
        private final List<String> filePaths = new ArrayList<>();
        private RiskLevel riskAssessment = RiskLevel.MEDIUM;

        private Builder(String toolName) {
            this.toolName = Objects.requireNonNull(toolName, "toolName must not be null");
        }

        public Builder userId(String value) {
            this.userId = value;
            return this;
        }

        public Builder parameter(String key, String value) {
            parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, String> values) {
            parameters.putAll(values);
            return this;
        }

        public Builder resourceLimits(RequestedLimits value) {
            this.resourceLimits = value;
            return this;
        }

        public Builder containsSecrets(boolean value) {
            this.containsSecrets = value;
            return this;
        }

        public Builder networkAccess(boolean value) {
            this.networkAccess = value;
            return this;
        }

        public Builder filePath(String path) {
            filePaths.add(path);
            return this;
        }

        public Builder filePaths(List<String> paths) {
            filePaths.addAll(paths);
            return this;
        }

        public Builder riskAssessment(RiskLevel value) {
            this.riskAssessment = value;
            return this;
        }

        public PolicyRequest build() {
            return new PolicyRequest(
                userId,
                toolName,
                parameters,
                resourceLimits,
                containsSecrets,
                networkAccess,
                filePaths,
                riskAssessment
            );
        }
    }
}

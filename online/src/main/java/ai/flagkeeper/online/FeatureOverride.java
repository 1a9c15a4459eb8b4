/*
 *    Copyright (C) 2026 The Flagkeeper Authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package ai.flagkeeper.online;

import java.time.Instant;
import java.util.Objects;

/**
 * A targeted exception to a feature's default, scoped to one user or one group. Overrides are never
 * updated in place; {@code createdAt} is fixed at creation and only used to order competing group
 * overrides.
 */
public class FeatureOverride {
    private final long id;
    private final long featureId;
    private final TargetType targetType;
    private final String targetIdentifier;
    private final boolean enabled;
    private final Instant createdAt;

    private FeatureOverride(Builder builder) {
        this.id = builder.id;
        this.featureId = builder.featureId;
        this.targetType = builder.targetType;
        this.targetIdentifier = builder.targetIdentifier;
        this.enabled = builder.enabled;
        this.createdAt = builder.createdAt;
    }

    public long getId() {
        return id;
    }

    public long getFeatureId() {
        return featureId;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public String getTargetIdentifier() {
        return targetIdentifier;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureOverride)) return false;
        FeatureOverride other = (FeatureOverride) o;
        return id == other.id
                && featureId == other.featureId
                && enabled == other.enabled
                && targetType == other.targetType
                && Objects.equals(targetIdentifier, other.targetIdentifier)
                && Objects.equals(createdAt, other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, featureId, targetType, targetIdentifier, enabled, createdAt);
    }

    @Override
    public String toString() {
        return "FeatureOverride{id=" + id + ", featureId=" + featureId + ", " + targetType + ":'"
                + targetIdentifier + "', enabled=" + enabled + ", createdAt=" + createdAt + "}";
    }

    public static class Builder {
        private long id;
        private long featureId;
        private TargetType targetType;
        private String targetIdentifier;
        private boolean enabled;
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder featureId(long featureId) {
            this.featureId = featureId;
            return this;
        }

        public Builder targetType(TargetType targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder targetIdentifier(String targetIdentifier) {
            this.targetIdentifier = targetIdentifier;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public FeatureOverride build() {
            return new FeatureOverride(this);
        }
    }
}

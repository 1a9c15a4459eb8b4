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
 * A named, globally toggleable capability. {@code key} is the immutable identity; {@code defaultEnabled}
 * is what evaluation returns when no override applies.
 */
public class Feature {
    private final long id;
    private final String key;
    private final boolean defaultEnabled;
    private final String description;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Feature(Builder builder) {
        this.id = builder.id;
        this.key = builder.key;
        this.defaultEnabled = builder.defaultEnabled;
        this.description = builder.description;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public long getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public boolean isDefaultEnabled() {
        return defaultEnabled;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .key(key)
                .defaultEnabled(defaultEnabled)
                .description(description)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Feature)) return false;
        Feature other = (Feature) o;
        return id == other.id
                && defaultEnabled == other.defaultEnabled
                && Objects.equals(key, other.key)
                && Objects.equals(description, other.description)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, key, defaultEnabled, description, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Feature{id=" + id + ", key='" + key + "', defaultEnabled=" + defaultEnabled + "}";
    }

    public static class Builder {
        private long id;
        private String key;
        private boolean defaultEnabled;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder defaultEnabled(boolean defaultEnabled) {
            this.defaultEnabled = defaultEnabled;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Feature build() {
            return new Feature(this);
        }
    }
}

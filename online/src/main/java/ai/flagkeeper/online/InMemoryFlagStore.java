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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link FlagStore} kept in process memory. A single read/write lock guards all state so uniqueness
 * checks and cascading deletes happen atomically with the write they protect.
 */
public class InMemoryFlagStore implements FlagStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryFlagStore.class);

    private static final Comparator<FeatureOverride> BY_RECENCY =
            Comparator.comparing(FeatureOverride::getCreatedAt)
                    .thenComparingLong(FeatureOverride::getId);

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private final Map<String, Feature> featuresByKey = new TreeMap<>();
    private final Map<Long, List<FeatureOverride>> overridesByFeature = new HashMap<>();
    private final Map<Long, FeatureOverride> overridesById = new HashMap<>();
    private long lastFeatureId = 0;
    private long lastOverrideId = 0;

    public InMemoryFlagStore() {
        this(Clock.systemUTC());
    }

    public InMemoryFlagStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Feature> findFeature(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return read(() -> Optional.ofNullable(featuresByKey.get(key)));
    }

    @Override
    public Optional<FeatureOverride> findOverride(Feature feature, TargetType targetType, String targetIdentifier) {
        return read(() -> overridesOf(feature.getId()).stream()
                .filter(o -> o.getTargetType() == targetType && o.getTargetIdentifier().equals(targetIdentifier))
                .findFirst());
    }

    @Override
    public Optional<FeatureOverride> findLatestOverride(Feature feature, TargetType targetType, Collection<String> targetIdentifiers) {
        if (targetIdentifiers == null || targetIdentifiers.isEmpty()) {
            return Optional.empty();
        }
        Set<String> wanted = new HashSet<>(targetIdentifiers);
        return read(() -> overridesOf(feature.getId()).stream()
                .filter(o -> o.getTargetType() == targetType && wanted.contains(o.getTargetIdentifier()))
                .max(BY_RECENCY));
    }

    @Override
    public Optional<FeatureOverride> findOverrideById(Feature feature, long overrideId) {
        return read(() -> Optional.ofNullable(overridesById.get(overrideId))
                .filter(o -> o.getFeatureId() == feature.getId()));
    }

    @Override
    public List<Feature> listFeatures() {
        return read(() -> new ArrayList<>(featuresByKey.values()));
    }

    @Override
    public List<FeatureOverride> listOverrides(Feature feature) {
        return read(() -> new ArrayList<>(overridesOf(feature.getId())));
    }

    @Override
    public Feature createFeature(String key, boolean defaultEnabled, String description) {
        FlagValidations.validateFeatureKey(key).getValue();
        return write(() -> {
            if (featuresByKey.containsKey(key)) {
                throw new ConflictException("Feature key has already been taken: " + key);
            }
            Instant now = now();
            Feature feature = Feature.builder()
                    .id(++lastFeatureId)
                    .key(key)
                    .defaultEnabled(defaultEnabled)
                    .description(description)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            featuresByKey.put(key, feature);
            overridesByFeature.put(feature.getId(), new ArrayList<>());
            logger.info("Created {}", feature);
            return feature;
        });
    }

    @Override
    public Feature updateFeature(String key, Boolean defaultEnabled, String description) {
        FlagValidations.validateFeatureKey(key).getValue();
        return write(() -> {
            Feature existing = featuresByKey.get(key);
            if (existing == null) {
                throw new FeatureNotFoundException(key);
            }
            Feature updated = existing.toBuilder()
                    .defaultEnabled(defaultEnabled != null ? defaultEnabled : existing.isDefaultEnabled())
                    .description(description != null ? description : existing.getDescription())
                    .updatedAt(now())
                    .build();
            featuresByKey.put(key, updated);
            logger.info("Updated {}", updated);
            return updated;
        });
    }

    @Override
    public boolean deleteFeature(String key) {
        if (key == null) {
            return false;
        }
        return write(() -> {
            Feature removed = featuresByKey.remove(key);
            if (removed == null) {
                return false;
            }
            List<FeatureOverride> overrides = overridesByFeature.remove(removed.getId());
            for (FeatureOverride override : overrides) {
                overridesById.remove(override.getId());
            }
            logger.info("Deleted {} along with {} overrides", removed, overrides.size());
            return true;
        });
    }

    @Override
    public FeatureOverride createOverride(Feature feature, TargetType targetType, String targetIdentifier, boolean enabled) {
        FlagValidations.validateOverride(targetType, targetIdentifier).getValue();
        return write(() -> {
            List<FeatureOverride> overrides = overridesByFeature.get(feature.getId());
            if (overrides == null) {
                throw new FeatureNotFoundException(feature.getKey());
            }
            for (FeatureOverride existing : overrides) {
                if (existing.getTargetType() == targetType && existing.getTargetIdentifier().equals(targetIdentifier)) {
                    throw new ConflictException("Target identifier has already been taken for "
                            + feature.getKey() + " " + targetType + ": " + targetIdentifier);
                }
            }
            FeatureOverride override = FeatureOverride.builder()
                    .id(++lastOverrideId)
                    .featureId(feature.getId())
                    .targetType(targetType)
                    .targetIdentifier(targetIdentifier)
                    .enabled(enabled)
                    .createdAt(now())
                    .build();
            overrides.add(override);
            overridesById.put(override.getId(), override);
            logger.info("Created {}", override);
            return override;
        });
    }

    @Override
    public void deleteOverride(long overrideId) {
        write(() -> {
            FeatureOverride removed = overridesById.remove(overrideId);
            if (removed != null) {
                overridesByFeature.get(removed.getFeatureId()).remove(removed);
                logger.info("Deleted {}", removed);
            }
            return null;
        });
    }

    private List<FeatureOverride> overridesOf(long featureId) {
        List<FeatureOverride> overrides = overridesByFeature.get(featureId);
        return overrides == null ? new ArrayList<>() : overrides;
    }

    // millisecond precision, same as what the jdbc store round-trips
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private <T> T read(Supplier<T> body) {
        lock.readLock().lock();
        try {
            return body.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> body) {
        lock.writeLock().lock();
        try {
            return body.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}

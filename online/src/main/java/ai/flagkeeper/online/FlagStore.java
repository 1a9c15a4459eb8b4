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

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for features and their overrides.
 *
 * Reads are what {@link FlagEvaluator} consumes; writes are used by the administrative surface. Every
 * write is validated with {@link FlagValidations} and checked against the uniqueness rules before it
 * lands:
 * <ul>
 *   <li>feature keys are unique</li>
 *   <li>(feature, target type, target identifier) is unique among overrides</li>
 * </ul>
 * Deleting a feature deletes its overrides in the same atomic step.
 *
 * Implementations throw {@link FlagStoreException} when the backing storage can't be reached. Absence
 * is always reported as an empty {@link Optional}, never as an exception.
 */
public interface FlagStore extends AutoCloseable {

    Optional<Feature> findFeature(String key);

    Optional<FeatureOverride> findOverride(Feature feature, TargetType targetType, String targetIdentifier);

    /**
     * Among the feature's overrides of the given type whose identifier is in {@code targetIdentifiers},
     * returns the most recently created one. Equal creation times are broken by the highest id.
     * Returns empty if the collection is empty or nothing matches.
     */
    Optional<FeatureOverride> findLatestOverride(Feature feature, TargetType targetType, Collection<String> targetIdentifiers);

    Optional<FeatureOverride> findOverrideById(Feature feature, long overrideId);

    /** All features ordered by key. */
    List<Feature> listFeatures();

    /** The feature's overrides in creation order. */
    List<FeatureOverride> listOverrides(Feature feature);

    Feature createFeature(String key, boolean defaultEnabled, String description);

    /**
     * Changes the mutable attributes of an existing feature. The key, id and creation time are kept.
     * A {@code null} {@code defaultEnabled} or {@code description} keeps the current value; the merge
     * happens atomically with the write.
     *
     * @throws FeatureNotFoundException if no feature has this key
     */
    Feature updateFeature(String key, Boolean defaultEnabled, String description);

    /**
     * Removes the feature and all of its overrides.
     *
     * @return whether a feature was removed
     */
    boolean deleteFeature(String key);

    /**
     * @throws ConflictException if the feature already has an override for this target
     * @throws FeatureNotFoundException if the feature has been deleted
     */
    FeatureOverride createOverride(Feature feature, TargetType targetType, String targetIdentifier, boolean enabled);

    /** Idempotent: deleting an unknown id is not an error. */
    void deleteOverride(long overrideId);

    @Override
    default void close() {
    }
}

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a feature is enabled for a user and the groups they belong to.
 *
 * Precedence, highest first:
 * <ol>
 *   <li>an override targeting the user</li>
 *   <li>the most recently created override targeting one of the groups</li>
 *   <li>the feature's default</li>
 * </ol>
 * Unknown features are disabled. The evaluator holds no state besides the store handle and never
 * writes, so a single instance can be shared across threads. Store failures are not caught here:
 * they surface as {@link FlagStoreException} rather than as a disabled flag.
 */
public class FlagEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(FlagEvaluator.class);

  private final FlagStore flagStore;

  public FlagEvaluator(FlagStore flagStore) {
    this.flagStore = Objects.requireNonNull(flagStore);
  }

  public boolean isEnabled(EvaluationRequest request) {
    return isEnabled(request.featureKey, request.userId, request.groups);
  }

  public boolean isEnabled(String featureKey, String userId, Collection<String> groups) {
    Optional<Feature> maybeFeature = flagStore.findFeature(featureKey);
    if (!maybeFeature.isPresent()) {
      logger.debug("Feature {} not found, treating as disabled", featureKey);
      return false;
    }
    Feature feature = maybeFeature.get();

    if (!FlagValidations.isBlank(userId)) {
      Optional<FeatureOverride> userOverride = flagStore.findOverride(feature, TargetType.User, userId);
      if (userOverride.isPresent()) {
        logger.debug("Feature {} resolved by user override {}", featureKey, userOverride.get());
        return userOverride.get().isEnabled();
      }
    }

    Set<String> groupIds = nonBlank(groups);
    if (!groupIds.isEmpty()) {
      Optional<FeatureOverride> groupOverride = flagStore.findLatestOverride(feature, TargetType.Group, groupIds);
      if (groupOverride.isPresent()) {
        logger.debug("Feature {} resolved by group override {}", featureKey, groupOverride.get());
        return groupOverride.get().isEnabled();
      }
    }

    return feature.isDefaultEnabled();
  }

  /**
   * Evaluates each request independently. A store failure on one request is captured in its response
   * and doesn't affect the others. Responses keep the order of the requests.
   */
  public List<EvaluationResponse> evaluateAll(List<EvaluationRequest> requests) {
    List<EvaluationResponse> responses = new ArrayList<>(requests.size());
    for (EvaluationRequest request : requests) {
      JTry<Boolean> result;
      try {
        result = JTry.success(isEnabled(request));
      } catch (FlagStoreException e) {
        logger.error("Failed to evaluate {}", request, e);
        result = JTry.failure(e);
      }
      responses.add(new EvaluationResponse(request, result));
    }
    return responses;
  }

  private static Set<String> nonBlank(Collection<String> groups) {
    Set<String> result = new LinkedHashSet<>();
    if (groups == null) {
      return result;
    }
    for (String group : groups) {
      if (!FlagValidations.isBlank(group)) {
        result.add(group);
      }
    }
    return result;
  }
}

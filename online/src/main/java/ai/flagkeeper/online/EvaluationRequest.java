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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class EvaluationRequest {
  public String featureKey;
  public String userId;
  public Set<String> groups;

  public EvaluationRequest(String featureKey, String userId) {
    this(featureKey, userId, null);
  }

  public EvaluationRequest(String featureKey, String userId, Collection<String> groups) {
    this.featureKey = featureKey;
    this.userId = userId;
    this.groups = groups == null ? Collections.emptySet() : new LinkedHashSet<>(groups);
  }

  @Override
  public String toString() {
    return "EvaluationRequest{featureKey='" + featureKey + "', userId='" + userId + "', groups=" + groups + "}";
  }
}

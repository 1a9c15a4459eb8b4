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

/**
 * An administrative write referenced a feature that does not exist. Evaluation never raises this;
 * unknown features evaluate to {@code false}.
 */
public class FeatureNotFoundException extends FlagStoreException {

    public FeatureNotFoundException(String featureKey) {
        super("Feature not found: " + featureKey);
    }

    public FeatureNotFoundException(String featureKey, Throwable cause) {
        super("Feature not found: " + featureKey, cause);
    }
}

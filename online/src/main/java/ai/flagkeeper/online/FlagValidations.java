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
 * Pre-write checks run by every {@link FlagStore} before touching storage. Failures carry a
 * {@link ValidationException}; uniqueness is left to the store itself.
 */
public final class FlagValidations {

    private FlagValidations() {
    }

    public static JTry<String> validateFeatureKey(String key) {
        if (isBlank(key)) {
            return JTry.failure(new ValidationException("key can't be blank"));
        }
        return JTry.success(key);
    }

    public static JTry<String> validateTargetIdentifier(String targetIdentifier) {
        if (isBlank(targetIdentifier)) {
            return JTry.failure(new ValidationException("target_identifier can't be blank"));
        }
        return JTry.success(targetIdentifier);
    }

    public static JTry<TargetType> validateTargetType(TargetType targetType) {
        if (targetType == null) {
            return TargetType.parse(null);
        }
        return JTry.success(targetType);
    }

    /**
     * Checks a prospective override. The returned value is the target identifier.
     */
    public static JTry<String> validateOverride(TargetType targetType, String targetIdentifier) {
        return validateTargetType(targetType).flatMap(t -> validateTargetIdentifier(targetIdentifier));
    }

    static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

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

import java.util.Arrays;

/**
 * What an override is scoped to. Names match the persisted values exactly.
 */
public enum TargetType {
    User,
    Group;

    public static JTry<TargetType> parse(String value) {
        for (TargetType type : values()) {
            if (type.name().equals(value)) {
                return JTry.success(type);
            }
        }
        return JTry.failure(new ValidationException(
                "target_type must be one of " + Arrays.toString(values()) + ", got: " + value));
    }
}

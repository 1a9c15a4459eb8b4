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
 * Raised when the underlying store cannot serve a read or write, e.g. the database is unreachable.
 * Evaluation never turns this into a {@code false} result.
 */
public class FlagStoreException extends RuntimeException {

    public FlagStoreException(String message) {
        super(message);
    }

    public FlagStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

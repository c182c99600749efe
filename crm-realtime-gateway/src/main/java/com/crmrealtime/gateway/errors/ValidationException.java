/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.crmrealtime.gateway.errors;

import java.util.List;

/** Input rejected before it reaches the event bus or the subscription registry. */
public class ValidationException extends IllegalArgumentException {

    private final List<String> rejected;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> rejected) {
        super(message);
        this.rejected = List.copyOf(rejected);
    }

    /** The offending values, such as invalid topic patterns. May be empty. */
    public List<String> getRejected() {
        return rejected;
    }
}

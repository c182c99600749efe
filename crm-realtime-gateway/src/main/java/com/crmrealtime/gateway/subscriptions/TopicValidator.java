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
package com.crmrealtime.gateway.subscriptions;

import com.crmrealtime.api.topics.TopicPattern;
import com.crmrealtime.gateway.errors.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/** Checks client supplied patterns against the topic syntax and the taxonomy allow-list. */
public class TopicValidator {

    private final List<String> allowedPrefixes;

    public TopicValidator(List<String> allowedPrefixes) {
        this.allowedPrefixes = List.copyOf(allowedPrefixes);
    }

    public boolean isValid(String pattern) {
        if (!TopicPattern.isWellFormedPattern(pattern)) {
            return false;
        }
        for (String prefix : allowedPrefixes) {
            if (pattern.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Validate a whole request: either every pattern is accepted or the request is rejected.
     *
     * @return the distinct patterns, in request order
     */
    public List<String> validate(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new ValidationException("No topics specified");
        }
        final List<String> rejected = new ArrayList<>();
        for (String pattern : patterns) {
            if (!isValid(pattern)) {
                rejected.add(String.valueOf(pattern));
            }
        }
        if (!rejected.isEmpty()) {
            throw new ValidationException("Invalid topics: " + rejected, rejected);
        }
        return new ArrayList<>(new LinkedHashSet<>(patterns));
    }
}

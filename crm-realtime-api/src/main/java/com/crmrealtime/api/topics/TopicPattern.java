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
package com.crmrealtime.api.topics;

import java.util.regex.Pattern;

/**
 * Topic syntax and matching. Event types are dot-delimited segments ({@code deal.stage.updated});
 * a subscription pattern is either an exact event type or a prefix followed by {@code .*}, which
 * matches the prefix itself and every event type below it.
 */
public final class TopicPattern {

    public static final String WILDCARD_SUFFIX = ".*";

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_-]+");

    private TopicPattern() {}

    public static boolean matches(String pattern, String eventType) {
        if (pattern.equals(eventType)) {
            return true;
        }
        if (!pattern.endsWith(WILDCARD_SUFFIX)) {
            return false;
        }
        final String prefix = pattern.substring(0, pattern.length() - WILDCARD_SUFFIX.length());
        return eventType.equals(prefix) || eventType.startsWith(prefix + ".");
    }

    public static boolean isWellFormedEventType(String eventType) {
        if (eventType == null || eventType.isEmpty()) {
            return false;
        }
        for (String segment : eventType.split("\\.", -1)) {
            if (!SEGMENT.matcher(segment).matches()) {
                return false;
            }
        }
        return true;
    }

    public static boolean isWellFormedPattern(String pattern) {
        if (pattern == null) {
            return false;
        }
        if (pattern.endsWith(WILDCARD_SUFFIX)) {
            return isWellFormedEventType(
                    pattern.substring(0, pattern.length() - WILDCARD_SUFFIX.length()));
        }
        return isWellFormedEventType(pattern);
    }
}

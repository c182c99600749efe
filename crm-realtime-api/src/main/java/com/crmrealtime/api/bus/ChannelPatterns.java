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
package com.crmrealtime.api.bus;

/** Glob matching for backend channel names: only a single trailing {@code *} is supported. */
public final class ChannelPatterns {

    public static final String WILDCARD = "*";

    private ChannelPatterns() {}

    public static boolean isPattern(String channel) {
        return channel.endsWith(WILDCARD);
    }

    public static boolean matches(String pattern, String channel) {
        if (isPattern(pattern)) {
            return channel.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(channel);
    }

    /** The channel pattern covering every event type published under {@code prefix}. */
    public static String namespace(String prefix) {
        return prefix + "." + WILDCARD;
    }

    public static String channelFor(String prefix, String eventType) {
        return prefix + "." + eventType;
    }
}

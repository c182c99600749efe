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

import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.topics.TopicPattern;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Topic pattern to subscriber index. Writers serialize on a lock and publish a new immutable
 * snapshot; dispatch reads the current snapshot without locking.
 */
@Slf4j
public class SubscriptionRegistry {

    private final Object lock = new Object();
    private volatile Map<String, Set<Subscriber>> snapshot = Map.of();

    public void register(Subscriber subscriber, Collection<String> patterns) {
        update(
                copy -> {
                    for (String pattern : patterns) {
                        copy.computeIfAbsent(pattern, k -> new LinkedHashSet<>()).add(subscriber);
                    }
                });
        log.debug("Registered subscriber={} patterns={}", subscriber.id(), patterns);
    }

    public void unregister(Subscriber subscriber, Collection<String> patterns) {
        update(
                copy -> {
                    for (String pattern : patterns) {
                        removeFrom(copy, pattern, subscriber);
                    }
                });
        log.debug("Unregistered subscriber={} patterns={}", subscriber.id(), patterns);
    }

    public void unregisterAll(Subscriber subscriber) {
        update(
                copy -> {
                    for (String pattern : new ArrayList<>(copy.keySet())) {
                        removeFrom(copy, pattern, subscriber);
                    }
                });
    }

    private static void removeFrom(
            Map<String, Set<Subscriber>> copy, String pattern, Subscriber subscriber) {
        final Set<Subscriber> subscribers = copy.get(pattern);
        if (subscribers != null && subscribers.remove(subscriber) && subscribers.isEmpty()) {
            copy.remove(pattern);
        }
    }

    private void update(Consumer<Map<String, Set<Subscriber>>> change) {
        synchronized (lock) {
            final Map<String, Set<Subscriber>> copy = new HashMap<>();
            snapshot.forEach(
                    (pattern, subscribers) -> copy.put(pattern, new LinkedHashSet<>(subscribers)));
            change.accept(copy);
            final Map<String, Set<Subscriber>> next = new HashMap<>();
            copy.forEach((pattern, subscribers) -> next.put(pattern, Set.copyOf(subscribers)));
            snapshot = Map.copyOf(next);
        }
    }

    /**
     * Subscribers whose patterns match the event type, each listed once. An event carrying a
     * company only reaches subscribers scoped to that same company.
     */
    public List<Subscriber> resolve(Event event) {
        final String eventCompany = event.companyId();
        final Set<Subscriber> result = new LinkedHashSet<>();
        for (Map.Entry<String, Set<Subscriber>> entry : snapshot.entrySet()) {
            if (!TopicPattern.matches(entry.getKey(), event.eventType())) {
                continue;
            }
            for (Subscriber subscriber : entry.getValue()) {
                if (eventCompany == null || eventCompany.equals(subscriber.companyId())) {
                    result.add(subscriber);
                }
            }
        }
        return new ArrayList<>(result);
    }

    /** Number of patterns with at least one subscriber. */
    public int liveEntryCount() {
        return snapshot.size();
    }

    public int subscriberCount() {
        final Set<Subscriber> all = new HashSet<>();
        snapshot.values().forEach(all::addAll);
        return all.size();
    }

    public Set<String> patternsOf(Subscriber subscriber) {
        final Set<String> patterns = new LinkedHashSet<>();
        snapshot.forEach(
                (pattern, subscribers) -> {
                    if (subscribers.contains(subscriber)) {
                        patterns.add(pattern);
                    }
                });
        return patterns;
    }
}

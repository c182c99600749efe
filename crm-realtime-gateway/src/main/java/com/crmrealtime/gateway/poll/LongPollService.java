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
package com.crmrealtime.gateway.poll;

import com.crmrealtime.api.events.Event;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.api.PollResponse;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.errors.ValidationException;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.crmrealtime.gateway.subscriptions.TopicValidator;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

/**
 * Long-polling transport. A poll registers a temporary subscriber and completes when the first
 * batch is ready or when the timeout expires, whichever comes first. Events published while no
 * poll is pending are not buffered.
 */
@Slf4j
public class LongPollService implements AutoCloseable {

    static final Duration FLUSH_DELAY = Duration.ofMillis(50);

    private final SubscriptionRegistry registry;
    private final TopicValidator topicValidator;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;
    private final int maxBatchSize;
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(
                    new BasicThreadFactory.Builder()
                            .namingPattern("longpoll-deadline-%d")
                            .daemon(true)
                            .build());

    public LongPollService(
            SubscriptionRegistry registry,
            TopicValidator topicValidator,
            GatewayMetrics metrics,
            Clock clock,
            int defaultTimeoutSeconds,
            int maxTimeoutSeconds,
            int maxBatchSize) {
        this.registry = registry;
        this.topicValidator = topicValidator;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * @param timeout raw {@code timeout} query parameter, may be null
     * @return the effective timeout, capped to the configured maximum
     */
    public Duration resolveTimeout(String timeout) {
        if (StringUtils.isBlank(timeout)) {
            return Duration.ofSeconds(defaultTimeoutSeconds);
        }
        final int seconds;
        try {
            seconds = Integer.parseInt(timeout.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid timeout: " + timeout);
        }
        if (seconds <= 0) {
            throw new ValidationException("timeout must be positive");
        }
        return Duration.ofSeconds(Math.min(seconds, maxTimeoutSeconds));
    }

    /** Parse the comma separated {@code topics} query parameter. */
    public List<String> parseTopics(String topics) {
        if (StringUtils.isBlank(topics)) {
            throw new ValidationException("No topics specified");
        }
        return topicValidator.validate(
                Arrays.stream(topics.split(","))
                        .map(String::trim)
                        .filter(StringUtils::isNotEmpty)
                        .toList());
    }

    /**
     * Wait for events matching the topics. Cancelling the returned future releases the
     * registration.
     */
    public CompletableFuture<PollResponse> poll(
            AuthenticatedContext context, List<String> topics, String cursor, Duration timeout) {
        final PollWaiter waiter =
                new PollWaiter(context.companyId(), maxBatchSize, metrics, this::scheduleFlush);
        registry.register(waiter, topics);
        final ScheduledFuture<?> deadline =
                scheduler.schedule(waiter::flush, timeout.toMillis(), TimeUnit.MILLISECONDS);
        log.debug(
                "Poll waiter={} user_id={} topics={} timeout={}",
                waiter.id(),
                context.userId(),
                topics,
                timeout);

        final CompletableFuture<PollResponse> response =
                waiter.result()
                        .whenComplete(
                                (batch, error) -> {
                                    registry.unregisterAll(waiter);
                                    deadline.cancel(false);
                                    if (error instanceof CancellationException) {
                                        metrics.longPollRequest("cancelled");
                                        log.debug("Poll waiter={} cancelled", waiter.id());
                                    }
                                })
                        .thenApply(
                                batch -> {
                                    metrics.longPollRequest(
                                            batch.events().isEmpty() ? "timeout" : "events");
                                    return new PollResponse(
                                            batch.events(),
                                            nextCursor(batch.events(), cursor),
                                            clock.instant(),
                                            batch.hasMore());
                                });
        response.whenComplete(
                (r, error) -> {
                    if (error instanceof CancellationException) {
                        waiter.result().cancel(false);
                    }
                });
        return response;
    }

    private static String nextCursor(List<Event> events, String cursor) {
        if (!events.isEmpty()) {
            return events.get(events.size() - 1).eventId();
        }
        return StringUtils.isNotBlank(cursor) ? cursor : UUID.randomUUID().toString();
    }

    // concurrent deliveries get a short window to join the batch
    private void scheduleFlush(PollWaiter waiter) {
        try {
            scheduler.schedule(waiter::flush, FLUSH_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            waiter.flush();
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

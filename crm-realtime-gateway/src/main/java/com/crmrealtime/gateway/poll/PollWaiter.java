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
import com.crmrealtime.gateway.subscriptions.Subscriber;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A pending poll request. Collects matching events until the batch is flushed, the deadline
 * expires or the client goes away. A full batch is flushed at once, so the waiter leaves the
 * registry before it would have to turn events away. The future completes exactly once.
 */
class PollWaiter implements Subscriber {

    private final String waiterId = UUID.randomUUID().toString();
    private final String companyId;
    private final int maxBatchSize;
    private final GatewayMetrics metrics;
    private final Consumer<PollWaiter> onFirstEvent;
    private final List<Event> events = new ArrayList<>();
    private final CompletableFuture<Batch> result = new CompletableFuture<>();
    private boolean flushed;

    record Batch(List<Event> events, boolean hasMore) {}

    PollWaiter(
            String companyId,
            int maxBatchSize,
            GatewayMetrics metrics,
            Consumer<PollWaiter> onFirstEvent) {
        this.companyId = companyId;
        this.maxBatchSize = maxBatchSize;
        this.metrics = metrics;
        this.onFirstEvent = onFirstEvent;
    }

    @Override
    public String id() {
        return waiterId;
    }

    @Override
    public String companyId() {
        return companyId;
    }

    @Override
    public void deliver(Event event) {
        final boolean first;
        final boolean full;
        synchronized (this) {
            if (flushed || result.isDone()) {
                return;
            }
            events.add(event);
            first = events.size() == 1;
            full = events.size() >= maxBatchSize;
        }
        metrics.delivered(GatewayMetrics.Transport.longpoll);
        if (full) {
            flush();
        } else if (first) {
            onFirstEvent.accept(this);
        }
    }

    /** Complete with whatever has been collected so far. */
    void flush() {
        final Batch batch;
        synchronized (this) {
            if (flushed) {
                return;
            }
            flushed = true;
            batch = new Batch(List.copyOf(events), events.size() >= maxBatchSize);
        }
        result.complete(batch);
    }

    CompletableFuture<Batch> result() {
        return result;
    }
}

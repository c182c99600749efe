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
package com.crmrealtime.gateway;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;

/** Meters of the gateway, registered on the Micrometer registry exported to Prometheus. */
public class GatewayMetrics {

    public enum Transport {
        websocket,
        longpoll
    }

    private final MeterRegistry registry;
    private final Counter publishedOk;
    private final Counter publishedFailed;
    private final Counter deliveredWebSocket;
    private final Counter deliveredLongPoll;
    private final Timer deliveryLatency;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.publishedOk =
                Counter.builder(MetricsNames.EVENTS_PUBLISHED)
                        .tag("result", "ok")
                        .register(registry);
        this.publishedFailed =
                Counter.builder(MetricsNames.EVENTS_PUBLISHED)
                        .tag("result", "failed")
                        .register(registry);
        this.deliveredWebSocket =
                Counter.builder(MetricsNames.EVENTS_DELIVERED)
                        .tag("transport", Transport.websocket.name())
                        .register(registry);
        this.deliveredLongPoll =
                Counter.builder(MetricsNames.EVENTS_DELIVERED)
                        .tag("transport", Transport.longpoll.name())
                        .register(registry);
        this.deliveryLatency =
                Timer.builder(MetricsNames.DELIVERY_LATENCY)
                        .description("Time between event creation and hand-off to subscribers")
                        .register(registry);
    }

    public void published(boolean ok) {
        (ok ? publishedOk : publishedFailed).increment();
    }

    public void delivered(Transport transport) {
        (transport == Transport.websocket ? deliveredWebSocket : deliveredLongPoll).increment();
    }

    public void dropped(String reason) {
        registry.counter(MetricsNames.EVENTS_DROPPED, "reason", reason).increment();
    }

    public void webSocketError(String kind) {
        registry.counter(MetricsNames.WEBSOCKET_ERRORS, "kind", kind).increment();
    }

    public void longPollRequest(String outcome) {
        registry.counter(MetricsNames.LONGPOLL_REQUESTS, "outcome", outcome).increment();
    }

    public void deliveryLatency(Duration latency) {
        if (!latency.isNegative()) {
            deliveryLatency.record(latency);
        }
    }

    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(registry);
    }
}

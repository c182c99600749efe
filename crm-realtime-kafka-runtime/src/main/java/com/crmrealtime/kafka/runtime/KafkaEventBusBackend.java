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
package com.crmrealtime.kafka.runtime;

import com.crmrealtime.api.bus.ChannelPatterns;
import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusListener;
import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.EventCodec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Every channel shares one Kafka topic. The channel is the record key, so events of the same type
 * land on the same partition and keep their order, and is repeated in a header.
 *
 * <p>Each gateway instance reads every partition from the latest offset without a consumer group:
 * all instances see all events, and nothing published before {@link #subscribe} is delivered.
 */
@Slf4j
public class KafkaEventBusBackend implements EventBusBackend {

    static final String CHANNEL_HEADER = "crm-channel";

    private final KafkaBackendConfiguration configuration;
    private final KafkaProducer<String, String> producer;
    private final Map<String, List<EventBusListener>> subscriptions = new ConcurrentHashMap<>();
    private KafkaConsumer<String, String> consumer;
    private Thread pollThread;
    private volatile boolean closed;

    public KafkaEventBusBackend(KafkaBackendConfiguration configuration) {
        this.configuration = configuration;
        if (configuration.createTopic()) {
            createTopicIfNeeded();
        }
        final Map<String, Object> producerConfig = new HashMap<>(configuration.kafkaConfig());
        producerConfig.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerConfig.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerConfig.putIfAbsent(
                ProducerConfig.MAX_BLOCK_MS_CONFIG, configuration.publishTimeout().toMillis());
        this.producer = new KafkaProducer<>(producerConfig);
        log.info("Kafka event bus ready on topic {}", configuration.topic());
    }

    private void createTopicIfNeeded() {
        try (AdminClient admin = AdminClient.create(configuration.kafkaConfig())) {
            admin.createTopics(
                            List.of(
                                    new NewTopic(
                                            configuration.topic(),
                                            configuration.partitions(),
                                            configuration.replicationFactor())))
                    .all()
                    .get(30, TimeUnit.SECONDS);
            log.info("Created topic {}", configuration.topic());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.debug("Topic {} already exists", configuration.topic());
            } else {
                throw new IllegalStateException(
                        "Cannot create topic " + configuration.topic(), e.getCause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while creating " + configuration.topic());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out creating " + configuration.topic(), e);
        }
    }

    @Override
    public boolean publish(String channel, Event event) {
        if (closed) {
            return false;
        }
        try {
            final ProducerRecord<String, String> record =
                    new ProducerRecord<>(configuration.topic(), channel, EventCodec.encode(event));
            record.headers().add(CHANNEL_HEADER, channel.getBytes(StandardCharsets.UTF_8));
            producer.send(record)
                    .get(configuration.publishTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error(
                    "Failed to publish event {} to {} on {}",
                    event.eventId(),
                    channel,
                    configuration.topic(),
                    e);
            return false;
        }
    }

    @Override
    public synchronized void subscribe(Collection<String> channels, EventBusListener listener) {
        if (closed) {
            throw new IllegalStateException("Backend is closed");
        }
        for (String channel : channels) {
            subscriptions.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(listener);
        }
        if (pollThread == null) {
            startConsumer();
        }
        log.info("Subscribed to channels {}", channels);
    }

    private void startConsumer() {
        final Map<String, Object> consumerConfig = new HashMap<>(configuration.kafkaConfig());
        consumerConfig.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerConfig.put(
                ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerConfig.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        consumerConfig.remove(ConsumerConfig.GROUP_ID_CONFIG);
        consumer = new KafkaConsumer<>(consumerConfig);
        final List<TopicPartition> partitions =
                consumer.partitionsFor(configuration.topic()).stream()
                        .map(info -> new TopicPartition(info.topic(), info.partition()))
                        .collect(Collectors.toList());
        consumer.assign(partitions);
        consumer.seekToEnd(partitions);
        // seeks are lazy: resolve them now, otherwise events published right after
        // subscribe() returns would be skipped
        for (TopicPartition partition : partitions) {
            log.info("Starting {} at offset {}", partition, consumer.position(partition));
        }
        pollThread =
                new BasicThreadFactory.Builder()
                        .namingPattern("kafka-bus-consumer-%d")
                        .daemon(true)
                        .build()
                        .newThread(this::pollLoop);
        pollThread.start();
    }

    private void pollLoop() {
        try {
            while (!closed) {
                final ConsumerRecords<String, String> records =
                        consumer.poll(configuration.pollTimeout());
                for (ConsumerRecord<String, String> record : records) {
                    dispatch(record);
                }
            }
        } catch (WakeupException e) {
            if (!closed) {
                log.error("Unexpected wakeup of the Kafka consumer", e);
            }
        } catch (Exception e) {
            log.error("Kafka consumer loop failed on topic {}", configuration.topic(), e);
        } finally {
            try {
                consumer.close();
            } catch (org.apache.kafka.common.errors.InterruptException e) {
                log.warn("Interrupted while closing Kafka consumer", e);
            }
        }
    }

    private void dispatch(ConsumerRecord<String, String> record) {
        final Header header = record.headers().lastHeader(CHANNEL_HEADER);
        final String channel =
                header != null ? new String(header.value(), StandardCharsets.UTF_8) : record.key();
        if (channel == null) {
            log.warn("Skipping record at {}-{} without channel", record.partition(), record.offset());
            return;
        }
        final List<EventBusListener> targets = new ArrayList<>();
        subscriptions.forEach(
                (pattern, listeners) -> {
                    if (ChannelPatterns.matches(pattern, channel)) {
                        targets.addAll(listeners);
                    }
                });
        if (targets.isEmpty()) {
            return;
        }
        final Event event;
        try {
            event = EventCodec.decode(record.value());
        } catch (Exception e) {
            log.error(
                    "Cannot decode record at {}-{} on {}",
                    record.partition(),
                    record.offset(),
                    channel,
                    e);
            return;
        }
        for (EventBusListener listener : targets) {
            try {
                listener.onEvent(channel, event);
            } catch (Throwable error) {
                log.error("Listener failed on {} for event {}", channel, event.eventId(), error);
            }
        }
    }

    @Override
    public void unsubscribe(Collection<String> channels) {
        channels.forEach(subscriptions::remove);
        log.info("Unsubscribed from channels {}", channels);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        subscriptions.clear();
        if (pollThread != null) {
            consumer.wakeup();
            try {
                pollThread.join(TimeUnit.SECONDS.toMillis(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        producer.close(Duration.ofSeconds(5));
        log.info("Kafka event bus closed");
    }
}

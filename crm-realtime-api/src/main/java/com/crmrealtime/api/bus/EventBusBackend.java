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

import com.crmrealtime.api.events.Event;
import java.util.Collection;

/**
 * Publish/subscribe primitive behind the gateway. Implementations are fire-and-forget: an event
 * published while no subscription matches its channel is not retained.
 *
 * <p>Channel names passed to {@link #subscribe} may end with {@code *} to match every channel
 * that starts with the preceding text.
 */
public interface EventBusBackend extends AutoCloseable {

    /**
     * Publish an event on a channel.
     *
     * @return false if the transport is unreachable or the backend has been closed
     */
    boolean publish(String channel, Event event);

    void subscribe(Collection<String> channels, EventBusListener listener);

    void unsubscribe(Collection<String> channels);

    @Override
    void close();
}

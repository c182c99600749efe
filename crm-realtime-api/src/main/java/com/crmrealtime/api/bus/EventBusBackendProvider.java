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

import java.util.Map;

/** Service provider for one kind of {@link EventBusBackend}, discovered by type name. */
public interface EventBusBackendProvider {

    boolean supports(String type);

    EventBusBackend createBackend(Map<String, Object> configuration);
}

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
package com.crmrealtime.gateway.http;

import com.crmrealtime.gateway.api.PollResponse;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.auth.GatewayRequestHandler;
import com.crmrealtime.gateway.errors.AuthenticationException;
import com.crmrealtime.gateway.poll.LongPollService;
import com.crmrealtime.gateway.util.HttpUtil;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

@RestController
@Slf4j
@AllArgsConstructor
public class PollResource {

    // the deadline of the poll itself always fires first
    private static final Duration ASYNC_TIMEOUT_SLACK = Duration.ofSeconds(5);

    private final LongPollService longPollService;
    private final GatewayRequestHandler gatewayRequestHandler;
    private final Clock clock;

    @GetMapping("/poll")
    DeferredResult<PollResponse> poll(
            @RequestParam(value = "topics", required = false) String topics,
            @RequestParam(value = "cursor", required = false) String cursor,
            @RequestParam(value = "timeout", required = false) String timeout,
            @RequestParam(value = "company_id", required = false) String companyId,
            @RequestHeader HttpHeaders headers)
            throws AuthenticationException {
        final AuthenticatedContext context =
                gatewayRequestHandler.authenticate(
                        HttpUtil.bearerToken(headers.getFirst(HttpHeaders.AUTHORIZATION)),
                        companyId,
                        headers.toSingleValueMap());
        final Duration pollTimeout = longPollService.resolveTimeout(timeout);
        final List<String> patterns = longPollService.parseTopics(topics);

        final DeferredResult<PollResponse> result =
                new DeferredResult<>(
                        pollTimeout.plus(ASYNC_TIMEOUT_SLACK).toMillis(),
                        () -> new PollResponse(List.of(), cursor, clock.instant(), false));
        final CompletableFuture<PollResponse> future =
                longPollService.poll(context, patterns, cursor, pollTimeout);
        future.whenComplete(
                (response, error) -> {
                    if (error == null) {
                        result.setResult(response);
                    } else if (!(error instanceof CancellationException)) {
                        result.setErrorResult(error);
                    }
                });
        result.onError(
                error -> {
                    log.debug("Poll aborted user_id={}: {}", context.userId(), error.getMessage());
                    future.cancel(false);
                });
        result.onTimeout(() -> future.cancel(false));
        result.onCompletion(() -> future.cancel(false));
        return result;
    }
}

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

import com.crmrealtime.gateway.errors.AuthenticationException;
import com.crmrealtime.gateway.errors.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
@Order(Ordered.LOWEST_PRECEDENCE)
@Slf4j
public class ResourceErrorsHandler {

    @ExceptionHandler(Throwable.class)
    ProblemDetail handleAll(Throwable exception) {
        if (exception instanceof final ResponseStatusException rs) {
            return ProblemDetail.forStatusAndDetail(rs.getStatusCode(), rs.getReason());
        }
        if (exception instanceof AuthenticationException) {
            log.info("Unauthorized: {}", exception.getMessage());
            return ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, exception.getMessage());
        }
        if (exception instanceof final ValidationException validation) {
            log.info("Bad request: {}", validation.getMessage());
            final ProblemDetail problem =
                    ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, validation.getMessage());
            if (!validation.getRejected().isEmpty()) {
                problem.setProperty("rejected", validation.getRejected());
            }
            return problem;
        }
        if (exception instanceof IllegalArgumentException) {
            log.error("Bad request", exception);
            return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
        }
        if (exception instanceof HttpMessageNotReadableException) {
            log.info("Unreadable request body: {}", exception.getMessage());
            return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Invalid JSON format");
        }
        log.error("Internal error", exception);
        return ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
    }
}

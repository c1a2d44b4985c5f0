package com.sparky.suppress.web;

import com.google.common.base.Stopwatch;
import com.sparky.suppress.Const;
import com.sparky.suppress.util.SuppressionMetrics;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Blocking request sender that waits out rate limiting. A 429 carrying the rate limit message is
 * retried after a fixed pause, with no retry cap. Every other response is handed back to the
 * caller. Transport failures are fatal.
 */
public class RateLimitedWebClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitedWebClient.class);
    private static final int TOO_MANY_REQUESTS = 429;

    private final Sleeper sleeper;
    private final SuppressionMetrics metrics;

    public RateLimitedWebClient(Sleeper sleeper, SuppressionMetrics metrics) {
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @param session        the http session to send on
     * @param requestCreator builds a fresh request for each attempt
     * @param backoffMs      pause before retrying a rate limited request
     * @return the first response that is not a rate limit rejection
     * @throws RemoteConnectionException when the request could not be sent or the wait was interrupted
     */
    public HttpResponse<String> send(HttpClient session, Supplier<HttpRequest> requestCreator, long backoffMs) {
        final UUID requestId = UUID.randomUUID();
        int attempt = 0;
        while (true) {
            HttpRequest request = requestCreator.get();
            LOGGER.debug("requestId={} Sending {} request to {}, attempt={}", requestId, request.method(), request.uri(), attempt);

            final Stopwatch sw = Stopwatch.createStarted();
            HttpResponse<String> response;
            try {
                response = session.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                LOGGER.error("requestId={} {} request to {} failed", requestId, request.method(), request.uri(), e);
                throw new RemoteConnectionException(request.uri(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteConnectionException(request.uri(), e);
            }
            sw.stop();

            LOGGER.debug("requestId={} {} request to {} completed in {}ms, attempt={}, status={}",
                requestId, request.method(), request.uri(), sw.elapsed(TimeUnit.MILLISECONDS), attempt, response.statusCode());

            if (!isRateLimited(response)) {
                return response;
            }

            metrics.recordRateLimitBackoff();
            LOGGER.warn(".. pausing {} seconds for rate-limiting", TimeUnit.MILLISECONDS.toSeconds(backoffMs));
            try {
                sleeper.sleep(backoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteConnectionException(request.uri(), e);
            }
            attempt++;
        }
    }

    /**
     * A 429 only counts as rate limiting when the first error message in the body says so.
     */
    static boolean isRateLimited(HttpResponse<String> response) {
        if (response.statusCode() != TOO_MANY_REQUESTS) {
            return false;
        }
        return Const.Api.RateLimitMessage.equals(firstErrorMessage(response.body()));
    }

    /**
     * @return {@code errors[0].message} of an API error body, or null when the body is not in that shape
     */
    public static String firstErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonObject json = new JsonObject(body);
            JsonArray errors = json.getJsonArray("errors");
            if (errors == null || errors.isEmpty() || !(errors.getValue(0) instanceof JsonObject)) {
                return null;
            }
            return errors.getJsonObject(0).getString("message");
        } catch (DecodeException | ClassCastException e) {
            return null;
        }
    }
}

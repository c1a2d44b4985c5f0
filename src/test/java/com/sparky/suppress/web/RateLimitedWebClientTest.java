package com.sparky.suppress.web;

import com.sparky.suppress.StubSuppressionServer;
import com.sparky.suppress.util.SuppressionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
public class RateLimitedWebClientTest {

    private StubSuppressionServer server;
    private HttpClient session;
    private List<Long> sleeps;
    private SuppressionMetrics metrics;
    private RateLimitedWebClient client;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        server = StubSuppressionServer.start(vertx);
        session = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        sleeps = new ArrayList<>();
        metrics = new SuppressionMetrics(new SimpleMeterRegistry());
        client = new RateLimitedWebClient(sleeps::add, metrics);
    }

    private HttpRequest get() {
        return HttpRequest.newBuilder(URI.create(server.baseUrl() + "/api/v1/suppression-list"))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
    }

    @Test
    void testSend_passesThroughSuccess() {
        server.reply(200, "{\"results\":[]}");

        HttpResponse<String> resp = client.send(session, this::get, 1000);

        assertEquals(200, resp.statusCode());
        assertEquals("{\"results\":[]}", resp.body());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testSend_waitsOutRateLimitingAndRetries() {
        server.reply(429, StubSuppressionServer.errorBody("Too many requests"))
            .reply(429, StubSuppressionServer.errorBody("Too many requests"))
            .reply(200, "{}");

        HttpResponse<String> resp = client.send(session, this::get, 120_000);

        assertEquals(200, resp.statusCode());
        assertEquals(List.of(120_000L, 120_000L), sleeps);
        assertEquals(3, server.received().size());
        assertEquals(2.0, metrics.rateLimitBackoffs());
    }

    @Test
    void testSend_otherTooManyRequestsMessageIsNotRetried() {
        server.reply(429, StubSuppressionServer.errorBody("Daily sending limit exceeded"));

        HttpResponse<String> resp = client.send(session, this::get, 1000);

        assertEquals(429, resp.statusCode());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, server.received().size());
    }

    @Test
    void testSend_errorStatusIsReturnedNotThrown() {
        server.reply(500, null);

        assertEquals(500, client.send(session, this::get, 1000).statusCode());
    }

    @Test
    void testSend_unreachableHostIsFatal() {
        Supplier<HttpRequest> unreachable = () -> HttpRequest.newBuilder(URI.create("http://localhost:1/api/v1/suppression-list"))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();

        assertThrows(RemoteConnectionException.class, () -> client.send(session, unreachable, 1000));
    }

    @Test
    void testSend_interruptedWaitIsFatal() {
        server.reply(429, StubSuppressionServer.errorBody("Too many requests"));
        RateLimitedWebClient interrupted = new RateLimitedWebClient(ms -> {
            throw new InterruptedException();
        }, metrics);

        assertThrows(RemoteConnectionException.class, () -> interrupted.send(session, this::get, 1000));
        assertTrue(Thread.interrupted());
    }

    // ==================== firstErrorMessage tests ====================

    @Test
    void testFirstErrorMessage() {
        assertEquals("Too many requests", RateLimitedWebClient.firstErrorMessage(StubSuppressionServer.errorBody("Too many requests")));
        assertNull(RateLimitedWebClient.firstErrorMessage("<html>busy</html>"));
        assertNull(RateLimitedWebClient.firstErrorMessage("{\"errors\":[]}"));
        assertNull(RateLimitedWebClient.firstErrorMessage("{\"errors\":\"nope\"}"));
        assertNull(RateLimitedWebClient.firstErrorMessage(null));
    }
}

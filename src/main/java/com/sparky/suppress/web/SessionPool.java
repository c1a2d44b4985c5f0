package com.sparky.suppress.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Fixed set of persistent HTTP sessions, sized once at construction. Slot {@code i} is meant for
 * one in-flight call at a time.
 */
public class SessionPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionPool.class);

    private final HttpClient[] sessions;

    public SessionPool(int size, Duration connectTimeout) {
        if (size <= 0) {
            throw new IllegalArgumentException("session pool size must be positive: " + size);
        }
        LOGGER.debug("creating {} http sessions", size);
        this.sessions = new HttpClient[size];
        for (int i = 0; i < size; ++i) {
            this.sessions[i] = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        }
    }

    public int size() {
        return sessions.length;
    }

    public HttpClient session(int slot) {
        return sessions[slot];
    }
}

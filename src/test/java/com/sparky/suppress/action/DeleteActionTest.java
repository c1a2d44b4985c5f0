package com.sparky.suppress.action;

import com.sparky.suppress.api.SuppressionListApi;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.model.SuppressionType;
import com.sparky.suppress.web.RemoteConnectionException;
import com.sparky.suppress.web.SessionPool;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class DeleteActionTest {

    private static final int POOL_SIZE = 3;

    private Vertx vertx;
    private SessionPool sessions;
    private SuppressionListApi api;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        sessions = new SessionPool(POOL_SIZE, Duration.ofSeconds(5));
        api = mock(SuppressionListApi.class);
    }

    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private BoundedDeleteExecutor executor() {
        return new BoundedDeleteExecutor(vertx, sessions, api, 5000);
    }

    private static List<SuppressionRecord> records(int count) {
        List<SuppressionRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(SuppressionRecord.of("user" + i + "@example.com", SuppressionType.TRANSACTIONAL));
        }
        return out;
    }

    // ==================== BoundedDeleteExecutor tests ====================

    @Test
    void testDispatch_countsConfirmedDeletes() {
        when(api.delete(any(), any())).thenReturn(true);
        when(api.delete(any(), argThat(r -> r != null && r.recipient().equals("user1@example.com")))).thenReturn(false);

        assertEquals(2, executor().dispatch(records(3)));
        verify(api, times(3)).delete(any(), any());
    }

    @Test
    void testDispatch_eachCallGetsItsOwnSession() {
        Set<HttpClient> used = Collections.synchronizedSet(new HashSet<>());
        when(api.delete(any(), any())).thenAnswer(inv -> used.add(inv.getArgument(0)));

        assertEquals(3, executor().dispatch(records(3)));
        assertEquals(3, used.size());
    }

    @Test
    void testDispatch_callsRunConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(POOL_SIZE);
        when(api.delete(any(), any())).thenAnswer(inv -> {
            allStarted.countDown();
            // only returns true when every call of the sub-batch is in flight at once
            return allStarted.await(5, TimeUnit.SECONDS);
        });

        assertEquals(POOL_SIZE, executor().dispatch(records(POOL_SIZE)));
    }

    @Test
    void testDispatch_rejectsOversizedSubBatch() {
        assertThrows(IllegalArgumentException.class, () -> executor().dispatch(records(POOL_SIZE + 1)));
        verifyNoInteractions(api);
    }

    @Test
    void testDispatch_emptySubBatch() {
        assertEquals(0, executor().dispatch(List.of()));
    }

    @Test
    void testDispatch_connectionFailureIsFatal() {
        when(api.delete(any(), any())).thenReturn(true);
        when(api.delete(any(), argThat(r -> r != null && r.recipient().equals("user2@example.com"))))
            .thenThrow(new RemoteConnectionException(URI.create("https://api.example.com"), new IOException("connection refused")));

        assertThrows(RemoteConnectionException.class, () -> executor().dispatch(records(3)));
    }

    @Test
    void testDispatch_otherFailuresAreNotCounted() {
        when(api.delete(any(), any())).thenReturn(true);
        when(api.delete(any(), argThat(r -> r != null && r.recipient().equals("user0@example.com"))))
            .thenThrow(new IllegalStateException("unexpected"));

        assertEquals(2, executor().dispatch(records(3)));
    }

    // ==================== DeleteAction tests ====================

    @Test
    void testApply_slicesIntoPoolSizedSubBatches() {
        BoundedDeleteExecutor executor = mock(BoundedDeleteExecutor.class);
        when(executor.poolSize()).thenReturn(POOL_SIZE);
        List<Integer> sizes = new ArrayList<>();
        when(executor.dispatch(any())).thenAnswer(inv -> {
            List<?> subBatch = inv.getArgument(0);
            sizes.add(subBatch.size());
            return subBatch.size() - 1;
        });

        int deleted = new DeleteAction(executor).apply(records(8));

        assertEquals(List.of(3, 3, 2), sizes);
        assertEquals(5, deleted);
    }

    @Test
    void testApply_endToEndWithExecutor() {
        AtomicInteger calls = new AtomicInteger();
        when(api.delete(any(), any())).thenAnswer(inv -> calls.incrementAndGet() > 0);

        DeleteAction action = new DeleteAction(executor());

        assertEquals("delete", action.name());
        assertEquals(7, action.apply(records(7)));
        assertEquals(7, calls.get());
    }
}

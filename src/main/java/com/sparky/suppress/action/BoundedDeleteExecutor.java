package com.sparky.suppress.action;

import com.sparky.suppress.api.SuppressionListApi;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.web.RemoteConnectionException;
import com.sparky.suppress.web.SessionPool;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one delete call per entry concurrently, each on its own session slot, and waits for all
 * of them. A fresh worker pool is created for every dispatch and closed when it is done.
 */
public class BoundedDeleteExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedDeleteExecutor.class);
    private static final long JOIN_GRACE_SECONDS = 10;

    private final Vertx vertx;
    private final SessionPool sessions;
    private final SuppressionListApi api;
    private final long joinTimeoutMs;
    private final AtomicInteger dispatchCounter = new AtomicInteger(0);

    public BoundedDeleteExecutor(Vertx vertx, SessionPool sessions, SuppressionListApi api) {
        this(vertx, sessions, api, TimeUnit.SECONDS.toMillis(api.requestTimeout().getSeconds() + JOIN_GRACE_SECONDS));
    }

    public BoundedDeleteExecutor(Vertx vertx, SessionPool sessions, SuppressionListApi api, long joinTimeoutMs) {
        this.vertx = vertx;
        this.sessions = sessions;
        this.api = api;
        this.joinTimeoutMs = joinTimeoutMs;
    }

    public int poolSize() {
        return sessions.size();
    }

    /**
     * @param subBatch at most {@link #poolSize()} entries
     * @return number of entries the remote confirmed as deleted
     * @throws RemoteConnectionException when any call could not reach the remote
     */
    public int dispatch(List<SuppressionRecord> subBatch) {
        if (subBatch.size() > sessions.size()) {
            throw new IllegalArgumentException("sub-batch of " + subBatch.size() + " exceeds pool size " + sessions.size());
        }
        if (subBatch.isEmpty()) {
            return 0;
        }

        WorkerExecutor workers = vertx.createSharedWorkerExecutor(
            "suppression-delete-" + dispatchCounter.incrementAndGet(), sessions.size());
        try {
            List<Future<Boolean>> calls = new ArrayList<>(subBatch.size());
            for (int slot = 0; slot < subBatch.size(); ++slot) {
                final int sessionSlot = slot;
                final SuppressionRecord record = subBatch.get(slot);
                calls.add(workers.executeBlocking(() -> api.delete(sessions.session(sessionSlot), record), false));
            }

            awaitAll(calls);
            return countDeleted(subBatch, calls);
        } finally {
            workers.close();
        }
    }

    private void awaitAll(List<Future<Boolean>> calls) {
        try {
            Future.join(calls).toCompletionStage().toCompletableFuture().get(joinTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // individual failures are inspected per call
            LOGGER.debug("at least one delete call failed: {}", e.getCause().toString());
        } catch (TimeoutException e) {
            LOGGER.warn("delete calls did not all finish within {}ms", joinTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for delete calls", e);
        }
    }

    private int countDeleted(List<SuppressionRecord> subBatch, List<Future<Boolean>> calls) {
        int deleted = 0;
        RemoteConnectionException fatal = null;
        for (int i = 0; i < calls.size(); ++i) {
            Future<Boolean> call = calls.get(i);
            String recipient = subBatch.get(i).recipient();
            if (!call.isComplete()) {
                LOGGER.error("{} : no response within {}ms", recipient, joinTimeoutMs);
            } else if (call.failed()) {
                if (call.cause() instanceof RemoteConnectionException && fatal == null) {
                    fatal = (RemoteConnectionException) call.cause();
                }
                LOGGER.error("{} : delete failed: {}", recipient, call.cause().toString());
            } else if (Boolean.TRUE.equals(call.result())) {
                deleted++;
            }
        }
        if (fatal != null) {
            throw fatal;
        }
        return deleted;
    }
}

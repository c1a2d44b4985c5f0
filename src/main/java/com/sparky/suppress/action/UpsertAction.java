package com.sparky.suppress.action;

import com.sparky.suppress.api.SuppressionListApi;
import com.sparky.suppress.model.SuppressionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Uploads a batch in one request. When the remote rejects it, the batch is split in half and each
 * half is retried on its own, down to single entries, so one bad entry only costs itself.
 */
public class UpsertAction implements ISuppressionAction {
    private static final Logger LOGGER = LoggerFactory.getLogger(UpsertAction.class);

    private final SuppressionListApi api;
    private final HttpClient session;

    public UpsertAction(SuppressionListApi api, HttpClient session) {
        this.api = api;
        this.session = session;
    }

    @Override
    public String name() {
        return "update";
    }

    @Override
    public int apply(List<SuppressionRecord> batch) {
        int done = 0;
        // ranges are [from, to) into batch; first half is pushed last so it is tried first
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, batch.size()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int from = range[0];
            int to = range[1];
            int size = to - from;
            if (size == 0) {
                continue;
            }

            List<SuppressionRecord> slice = batch.subList(from, to);
            if (api.upsert(session, slice)) {
                done += size;
                continue;
            }

            if (size == 1) {
                LOGGER.error("Entry {} rejected by remote, skipping it", slice.get(0).recipient());
                continue;
            }

            int mid = from + size / 2;
            LOGGER.info("Batch of {} rejected, retrying as {} and {}", size, mid - from, to - mid);
            pending.push(new int[]{mid, to});
            pending.push(new int[]{from, mid});
        }
        return done;
    }
}

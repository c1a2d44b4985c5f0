package com.sparky.suppress.action;

import com.sparky.suppress.model.SuppressionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deletes entries one call each, in pool-sized sub-batches that run one after the other.
 */
public class DeleteAction implements ISuppressionAction {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeleteAction.class);

    private final BoundedDeleteExecutor executor;

    public DeleteAction(BoundedDeleteExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String name() {
        return "delete";
    }

    @Override
    public int apply(List<SuppressionRecord> batch) {
        int poolSize = executor.poolSize();
        int deleted = 0;
        for (int from = 0; from < batch.size(); from += poolSize) {
            int to = Math.min(from + poolSize, batch.size());
            int done = executor.dispatch(batch.subList(from, to));
            LOGGER.debug("deleted {} of {} entries [{}, {})", done, to - from, from, to);
            deleted += done;
        }
        return deleted;
    }
}

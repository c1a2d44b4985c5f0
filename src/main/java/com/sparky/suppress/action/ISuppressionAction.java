package com.sparky.suppress.action;

import com.sparky.suppress.model.SuppressionRecord;

import java.util.List;

public interface ISuppressionAction {
    String name();

    /**
     * @return how many entries of the batch the remote actually took
     */
    int apply(List<SuppressionRecord> batch);
}

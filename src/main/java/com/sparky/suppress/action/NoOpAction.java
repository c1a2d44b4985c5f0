package com.sparky.suppress.action;

import com.sparky.suppress.model.SuppressionRecord;

import java.util.List;

/**
 * Used by {@code check}: validation only, nothing leaves the machine.
 */
public class NoOpAction implements ISuppressionAction {
    @Override
    public String name() {
        return "check";
    }

    @Override
    public int apply(List<SuppressionRecord> batch) {
        return 0;
    }
}

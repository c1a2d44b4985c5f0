package com.sparky.suppress.batch;

import io.vertx.core.json.JsonObject;

/**
 * Counters from one pass over an input file.
 */
public class RunSummary {
    private final long addrsChecked;
    private final long goodRecips;
    private final long badRecips;
    private final long duplicateRecips;
    private final long doneRecips;
    private final long flagsGood;
    private final long flagsDefaulted;
    private final long elapsedMs;

    public RunSummary(long addrsChecked, long goodRecips, long badRecips, long duplicateRecips,
                      long doneRecips, long flagsGood, long flagsDefaulted, long elapsedMs) {
        this.addrsChecked = addrsChecked;
        this.goodRecips = goodRecips;
        this.badRecips = badRecips;
        this.duplicateRecips = duplicateRecips;
        this.doneRecips = doneRecips;
        this.flagsGood = flagsGood;
        this.flagsDefaulted = flagsDefaulted;
        this.elapsedMs = elapsedMs;
    }

    public long getAddrsChecked() {
        return addrsChecked;
    }

    public long getGoodRecips() {
        return goodRecips;
    }

    public long getBadRecips() {
        return badRecips;
    }

    public long getDuplicateRecips() {
        return duplicateRecips;
    }

    public long getDoneRecips() {
        return doneRecips;
    }

    public long getFlagsGood() {
        return flagsGood;
    }

    public long getFlagsDefaulted() {
        return flagsDefaulted;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("addrsChecked", addrsChecked)
            .put("goodRecips", goodRecips)
            .put("badRecips", badRecips)
            .put("duplicateRecips", duplicateRecips)
            .put("doneRecips", doneRecips)
            .put("flagsGood", flagsGood)
            .put("flagsDefaulted", flagsDefaulted);
    }

    @Override
    public String toString() {
        return String.format("Checked %d email addresses in %.2f seconds: good=%d, bad=%d, duplicate=%d, done=%d, flagsGood=%d, flagsDefaulted=%d",
            addrsChecked, elapsedMs / 1000.0, goodRecips, badRecips, duplicateRecips, doneRecips, flagsGood, flagsDefaulted);
    }
}

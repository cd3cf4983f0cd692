/* (C)2026 */
package com.ammann.qkd.enumeration;

import com.ammann.qkd.model.SimulationStatistics;

/**
 * Coarse classification of a finished simulation run, used as metric tag.
 */
public enum RunOutcome {
    SYNCED("synced"),
    UNSYNCED("unsynced"),
    DEGENERATE("degenerate"),
    REJECTED("rejected");

    private final String tag;

    RunOutcome(String tag) {
        this.tag = tag;
    }

    /**
     * Classifies a statistics summary.
     *
     * @param statistics statistics of a completed run
     * @return DEGENERATE for empty runs, otherwise SYNCED or UNSYNCED
     */
    public static RunOutcome of(SimulationStatistics statistics) {
        if (statistics.status() == StatisticsStatus.DEGENERATE) return DEGENERATE;
        return statistics.syncSuccess() ? SYNCED : UNSYNCED;
    }

    public String getTag() { return tag; }
}

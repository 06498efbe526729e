package com.example.rcaengine.rca;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Guards the commit of one RCA run. Once aborted (e.g. by the timeout) the run
 * can no longer commit; once committed it can no longer be aborted.
 */
public final class RunToken {

    private static final int RUNNING = 0;
    private static final int COMMITTED = 1;
    private static final int ABORTED = 2;

    private final String incidentId;
    private final AtomicInteger state = new AtomicInteger(RUNNING);

    public RunToken(String incidentId) {
        this.incidentId = incidentId;
    }

    public String incidentId() {
        return incidentId;
    }

    public boolean tryCommit() {
        return state.compareAndSet(RUNNING, COMMITTED);
    }

    public boolean abort() {
        return state.compareAndSet(RUNNING, ABORTED);
    }

    public boolean isAborted() {
        return state.get() == ABORTED;
    }

    public boolean isCommitted() {
        return state.get() == COMMITTED;
    }
}

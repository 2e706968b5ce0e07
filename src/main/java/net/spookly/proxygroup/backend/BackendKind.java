package net.spookly.proxygroup.backend;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed classification of backends. Only routed backends count toward group health.
 */
public enum BackendKind {
    DIRECT,
    REJECT,
    PASS,
    COMPATIBLE,
    ROUTED;

    private static final Set<BackendKind> SENTINELS = EnumSet.of(DIRECT, REJECT, PASS, COMPATIBLE);

    /**
     * True when dial outcomes through this kind feed the group's failure accounting.
     */
    public boolean countsTowardGroupHealth() {
        return !SENTINELS.contains(this);
    }
}

package net.spookly.proxygroup.group;

/**
 * Every backend of a group failed or timed out during a latency probe.
 */
public class AllProbesFailedException extends RuntimeException {
    private final String groupName;
    private final int attempted;

    public AllProbesFailedException(String groupName, int attempted, Throwable cause) {
        super("No usable backend in group " + groupName + ": all " + attempted + " probe(s) failed", cause);
        this.groupName = groupName;
        this.attempted = attempted;
    }

    public String groupName() {
        return groupName;
    }

    public int attempted() {
        return attempted;
    }
}

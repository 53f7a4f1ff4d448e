package io.github.drompincen.clawguard.runtime.errors;

public class DepthExceededException extends ClawGuardException {

    private final int depth;
    private final int maxDepth;
    private final String caller;
    private final String attempted;

    public DepthExceededException(int depth, int maxDepth, String caller, String attempted) {
        super(String.format("max depth exceeded (depth=%d, maxDepth=%d, caller=%s, attempted=%s)",
                depth, maxDepth, caller, attempted));
        this.depth = depth;
        this.maxDepth = maxDepth;
        this.caller = caller;
        this.attempted = attempted;
    }

    public int getDepth() { return depth; }
    public int getMaxDepth() { return maxDepth; }
    public String getCaller() { return caller; }
    public String getAttempted() { return attempted; }
}

package villagecompute.jobengine.exceptions;

/**
 * Another worker won the conditional {@code PENDING -> RUNNING} update for the same job. Benign: the losing worker
 * simply moves on to the next poll cycle. Never surfaced to API callers.
 */
public class ClaimConflictException extends RuntimeException {

    private final long jobId;

    public ClaimConflictException(long jobId) {
        super("Job " + jobId + " was claimed by another worker");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}

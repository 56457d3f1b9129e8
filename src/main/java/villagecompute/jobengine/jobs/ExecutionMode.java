package villagecompute.jobengine.jobs;

/**
 * How the scheduler tick runs a schedule's job type. Declared by the handler, never by the call site.
 */
public enum ExecutionMode {

    /**
     * The tick enqueues a {@code jobs} row and the worker pool executes it. Used for long-running imports, exports and
     * translations.
     */
    QUEUED,

    /**
     * The tick invokes the handler directly. Reserved for sub-second system tasks such as token refresh.
     */
    INLINE
}

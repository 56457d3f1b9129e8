package villagecompute.jobengine.testing;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.jobengine.jobs.ExecutionMode;

/**
 * Scripted handler the scheduler runs inline.
 */
@ApplicationScoped
public class InlineTestJobHandler extends ScriptedJobHandler {

    public static final String TYPE = "test:inline";

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.INLINE;
    }
}

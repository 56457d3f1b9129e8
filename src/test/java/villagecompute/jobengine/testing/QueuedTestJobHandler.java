package villagecompute.jobengine.testing;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Scripted handler executed through the queue.
 */
@ApplicationScoped
public class QueuedTestJobHandler extends ScriptedJobHandler {

    public static final String TYPE = "test:scripted";

    @Override
    public String handlesType() {
        return TYPE;
    }
}

package villagecompute.jobengine.util;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Identifies this process in {@code locked_by}, {@code server_instance} and tick lease owners as
 * {@code hostname:pid}.
 */
public final class ServerInstance {

    private static final String ID = resolveHostname() + ":" + ProcessHandle.current().pid();

    private ServerInstance() {
    }

    public static String id() {
        return ID;
    }

    /**
     * Identifier of the calling worker thread: {@code hostname:pid:thread}.
     */
    public static String workerId() {
        return ID + ":" + Thread.currentThread().getName();
    }

    private static String resolveHostname() {
        String fromEnv = System.getenv("HOSTNAME");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}

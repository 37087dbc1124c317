package org.javai.transientfault.classify;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;

/**
 * Detects network connectivity failures such as "host not found", refused connections and
 * connections reset by the peer, anywhere in the cause chain.
 *
 * <p>Timeouts are not connectivity failures; compose with {@link TimeoutAwareErrorClassifier}
 * to retry them as well.</p>
 */
public class NetworkConnectivityErrorClassifier implements ErrorClassifier {

    @Override
    public boolean isTransient(Throwable error) {
        return Causes.anyMatch(error, NetworkConnectivityErrorClassifier::isConnectivityFailure);
    }

    static boolean isConnectivityFailure(Throwable t) {
        if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof UnknownHostException
                || t instanceof PortUnreachableException
                || t instanceof ClosedChannelException) {
            return true;
        }
        if (t instanceof SocketException) {
            return isResetOrAbort(t.getMessage());
        }
        return false;
    }

    private static boolean isResetOrAbort(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("connection reset")
                || lower.contains("broken pipe")
                || lower.contains("connection abort")
                || lower.contains("socket closed");
    }
}

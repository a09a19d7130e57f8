package io.recur4j.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Identity recorded on every execution row as {@code workerNode}.
 */
public final class WorkerIds {
    private static final Logger log = LoggerFactory.getLogger(WorkerIds.class);

    static final int MAX_LENGTH = 128;

    private WorkerIds() {
    }

    /**
     * The configured id if set, otherwise {@code host-pid}.
     */
    public static String resolve(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return truncate(configuredWorkerId.trim());
        }
        return truncate(hostName() + "-" + ProcessHandle.current().pid());
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("recur4j cannot resolve local host name, using default msg={}", e.getMessage());
            return "recur4j";
        }
    }

    private static String truncate(String id) {
        return id.length() > MAX_LENGTH ? id.substring(0, MAX_LENGTH) : id;
    }
}

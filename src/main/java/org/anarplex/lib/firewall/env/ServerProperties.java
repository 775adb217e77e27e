package org.anarplex.lib.firewall.env;

import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of the firewall server.  Defaults come from firewall.properties on the classpath and may be overridden by
 * JVM system properties of the same name (e.g. -Dreceive.timeout.millis=2000).
 */
public class ServerProperties {

    private static final Logger logger = LoggerFactory.getLogger(ServerProperties.class);

    public static final String RESOURCE_NAME = "/firewall.properties";

    public static final String PORT = "port";
    public static final String RECEIVE_TIMEOUT_MILLIS = "receive.timeout.millis";
    public static final String BUFFER_SIZE = "buffer.size";
    public static final String REQUEST_LOG_CAPACITY = "request.log.capacity";
    public static final String LISTEN_BACKLOG = "listen.backlog";

    // room for at least one character of response plus the terminator
    public static final int MIN_BUFFER_SIZE = 2;

    private static final Properties defaults = new Properties();

    static {
        defaults.setProperty(PORT, "0");
        defaults.setProperty(RECEIVE_TIMEOUT_MILLIS, "10000");
        defaults.setProperty(BUFFER_SIZE, "1024");
        defaults.setProperty(REQUEST_LOG_CAPACITY, "100");
        defaults.setProperty(LISTEN_BACKLOG, "128");
    }

    private final Properties properties;

    public ServerProperties(Properties p) {
        properties = new Properties();
        properties.putAll(defaults);
        properties.putAll(p);
    }

    /**
     * Loads firewall.properties from the classpath and applies system property overrides.  A missing resource
     * leaves the built-in defaults in place.
     */
    public static ServerProperties load() {
        Properties p = new Properties();
        try (InputStream in = ServerProperties.class.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                p.load(in);
            } else {
                logger.debug("{} not found on classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warn("Error reading {}: {}", RESOURCE_NAME, e.getMessage());
        }
        for (String key : defaults.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                p.setProperty(key, override);
            }
        }
        return new ServerProperties(p);
    }

    public ServerProperties withPort(int port) {
        Properties p = new Properties();
        p.putAll(properties);
        p.setProperty(PORT, Integer.toString(port));
        return new ServerProperties(p);
    }

    public int getPort() {
        return getInt(PORT);
    }

    public int getReceiveTimeoutMillis() {
        return getInt(RECEIVE_TIMEOUT_MILLIS);
    }

    public int getBufferSize() {
        int n = getInt(BUFFER_SIZE);
        if (n < MIN_BUFFER_SIZE) {
            logger.warn("Property {} must be at least {}: {}, using default {}", BUFFER_SIZE, MIN_BUFFER_SIZE, n, defaults.getProperty(BUFFER_SIZE));
            return Integer.parseInt(defaults.getProperty(BUFFER_SIZE));
        }
        return n;
    }

    public int getRequestLogCapacity() {
        return getInt(REQUEST_LOG_CAPACITY);
    }

    public int getListenBacklog() {
        return getInt(LISTEN_BACKLOG);
    }

    private int getInt(String key) {
        String value = properties.getProperty(key);
        int n = NumberUtils.toInt(value, -1);
        if (n < 0) {
            logger.warn("Property {} is not a non-negative integer: {}, using default {}", key, value, defaults.getProperty(key));
            return Integer.parseInt(defaults.getProperty(key));
        }
        return n;
    }
}

package org.anarplex.lib.firewall.env;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ServerPropertiesTest {

    @Test
    void testDefaultsFromClasspath() {
        ServerProperties p = ServerProperties.load();
        assertEquals(10000, p.getReceiveTimeoutMillis());
        assertEquals(1024, p.getBufferSize());
        assertEquals(100, p.getRequestLogCapacity());
        assertEquals(128, p.getListenBacklog());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(ServerProperties.REQUEST_LOG_CAPACITY, "5");
        try {
            assertEquals(5, ServerProperties.load().getRequestLogCapacity());
        } finally {
            System.clearProperty(ServerProperties.REQUEST_LOG_CAPACITY);
        }
    }

    @Test
    void testMalformedValueFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(ServerProperties.BUFFER_SIZE, "big");
        props.setProperty(ServerProperties.RECEIVE_TIMEOUT_MILLIS, "-1");
        ServerProperties p = new ServerProperties(props);
        assertEquals(1024, p.getBufferSize());
        assertEquals(10000, p.getReceiveTimeoutMillis());
    }

    @Test
    void testTooSmallBufferFallsBackToDefault() {
        for (String size : new String[] {"0", "1"}) {
            Properties props = new Properties();
            props.setProperty(ServerProperties.BUFFER_SIZE, size);
            assertEquals(1024, new ServerProperties(props).getBufferSize(), size);
        }
        Properties props = new Properties();
        props.setProperty(ServerProperties.BUFFER_SIZE, "2");
        assertEquals(2, new ServerProperties(props).getBufferSize());
    }

    @Test
    void testWithPort() {
        ServerProperties p = new ServerProperties(new Properties());
        assertEquals(0, p.getPort());
        assertEquals(2300, p.withPort(2300).getPort());
        assertEquals(0, p.getPort());
    }
}

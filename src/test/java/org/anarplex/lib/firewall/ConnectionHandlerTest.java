package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.env.MockProtocolStreams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionHandlerTest {

    private ProtocolEngine engine;
    private ByteArrayOutputStream serverOutput;

    @BeforeEach
    void setUp() {
        engine = new ProtocolEngine();
        serverOutput = new ByteArrayOutputStream();
    }

    @Test
    @DisplayName("One request in, one response out, then the connection is closed")
    void testSingleRequest() {
        MockProtocolStreams streams = connect("A 10.0.0.1 80\n");
        new ConnectionHandler(engine, 1024).onConnection(streams);

        assertEquals("Rule added", serverOutput.toString(StandardCharsets.UTF_8));
        assertTrue(streams.isClosed());
    }

    @Test
    @DisplayName("Only the first line of a request is processed")
    void testOnlyFirstLineProcessed() {
        new ConnectionHandler(engine, 1024).onConnection(connect("A 10.0.0.1 80\nA 10.0.0.2 80\n"));

        assertEquals("Rule added", serverOutput.toString(StandardCharsets.UTF_8));
        assertEquals(1, engine.getRuleStore().size());
    }

    @Test
    void testRequestWithoutNewline() {
        engine.submit("A 10.0.0.1 80");
        new ConnectionHandler(engine, 1024).onConnection(connect("C 10.0.0.1 80"));
        assertEquals("Connection accepted", serverOutput.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("A client that closes without sending never reaches the engine")
    void testEndOfStream() {
        MockProtocolStreams streams = connect("");
        new ConnectionHandler(engine, 1024).onConnection(streams);

        assertEquals(0, serverOutput.size());
        assertEquals(0, engine.getRequestLog().size());
        assertTrue(streams.isClosed());
    }

    @Test
    @DisplayName("A receive timeout drops the connection without a response")
    void testReceiveTimeout() {
        InputStream slow = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new SocketTimeoutException("Read timed out");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                return read();
            }
        };
        MockProtocolStreams streams = new MockProtocolStreams(slow, serverOutput);
        new ConnectionHandler(engine, 1024).onConnection(streams);

        assertEquals(0, serverOutput.size());
        assertEquals(0, engine.getRequestLog().size());
        assertTrue(streams.isClosed());
    }

    @Test
    @DisplayName("At most bufferSize-1 bytes are read")
    void testReadLimit() throws IOException {
        ConnectionHandler handler = new ConnectionHandler(engine, 8);
        String received = handler.receive(new ByteArrayInputStream("A 10.0.0.1 80".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("A 10.0.", received);
    }

    private MockProtocolStreams connect(String clientInput) {
        InputStream is = new ByteArrayInputStream(clientInput.getBytes(StandardCharsets.UTF_8));
        return new MockProtocolStreams(is, serverOutput);
    }
}

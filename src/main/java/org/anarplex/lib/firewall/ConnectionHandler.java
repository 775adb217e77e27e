package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.env.NetworkUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Serves one request per connection: a single read of at most bufferSize-1 bytes, cut at the first newline, is
 * submitted to the shared ProtocolEngine and the response is written back.  The connection is then closed.
 * There is no keep-alive.  A client that sends nothing before the receive timeout, or that closes its end first, is
 * dropped without a response and the engine is never invoked.
 */
public class ConnectionHandler implements NetworkUtilities.ConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final ProtocolEngine engine;
    private final int bufferSize;

    public ConnectionHandler(ProtocolEngine engine, int bufferSize) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        this.engine = engine;
        this.bufferSize = bufferSize;
    }

    @Override
    public void onConnection(NetworkUtilities.ProtocolStreams connection) {
        try {
            String request = receive(connection.getInputStream());
            if (request == null) {
                logger.debug("Connection from {} closed before a request was received", connection.getRemoteAddress());
                return;
            }
            // the engine's lock is only held while the request is processed, never while doing I/O
            String response = engine.submit(request);

            OutputStream out = connection.getOutputStream();
            out.write(response.getBytes(StandardCharsets.UTF_8));
            out.flush();
            logger.info("Completed request from {}", connection.getRemoteAddress());
        } catch (SocketTimeoutException e) {
            logger.warn("Timed out waiting for a request from {}", connection.getRemoteAddress());
        } catch (IOException e) {
            logger.warn("Error communicating with {}: {}", connection.getRemoteAddress(), e.getMessage());
        } finally {
            connection.closeConnection();
        }
    }

    /**
     * Performs the single read of a request.
     *
     * @return the request up to (not including) its first newline, or null at end of stream
     */
    String receive(InputStream in) throws IOException {
        byte[] buffer = new byte[bufferSize - 1];
        int length = in.read(buffer, 0, buffer.length);
        if (length <= 0) {
            return null;
        }
        String request = new String(buffer, 0, length, StandardCharsets.UTF_8);
        int newline = request.indexOf('\n');
        return newline < 0 ? request : request.substring(0, newline);
    }
}

package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.env.ServerProperties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Command line client for the firewall server.  Usage: client host port command...
 * The command words are joined with single spaces and sent as one request, e.g.
 * "client localhost 2300 A 10.0.0.1-10.0.0.10 8000-8010".  The response is printed on standard output.
 */
public class Client {

    public static final String USAGE = "Usage: client <serverHost> <serverPort> <command>";

    private static final Logger logger = LoggerFactory.getLogger(Client.class);

    private final String host;
    private final int port;
    private final int bufferSize;
    private final int timeoutMillis;

    public Client(String host, int port, ServerProperties properties) {
        // "localhost" is always the IPv4 loopback, which the server listens on
        this.host = "localhost".equals(host) ? "127.0.0.1" : host;
        this.port = port;
        this.bufferSize = properties.getBufferSize();
        this.timeoutMillis = properties.getReceiveTimeoutMillis();
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 3) {
            err.println(USAGE);
            return 1;
        }
        int port = NumberUtils.toInt(args[1], 0);
        String command = StringUtils.join(Arrays.copyOfRange(args, 2, args.length), ' ');
        try {
            out.println(new Client(args[0], port, ServerProperties.load()).send(command));
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Connection failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Sends one request (without a line terminator) and reads the response until the server closes the
     * connection or bufferSize-1 bytes have arrived.
     */
    public String send(String command) throws IOException {
        try (Socket socket = new Socket(host, port)) {
            socket.setSoTimeout(timeoutMillis);
            OutputStream out = socket.getOutputStream();
            out.write(command.getBytes(StandardCharsets.UTF_8));
            out.flush();
            logger.debug("Sent request to {}:{}: {}", host, port, command);

            InputStream in = socket.getInputStream();
            ByteArrayOutputStream response = new ByteArrayOutputStream();
            byte[] buffer = new byte[bufferSize - 1];
            int n;
            while (response.size() < buffer.length
                    && (n = in.read(buffer, 0, buffer.length - response.size())) > 0) {
                response.write(buffer, 0, n);
            }
            return response.toString(StandardCharsets.UTF_8);
        }
    }
}

package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.env.NetworkUtilities;
import org.anarplex.lib.firewall.env.ServerProperties;
import org.anarplex.lib.firewall.env.SocketNetworkUtilities;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * The firewall server process.  Usage:
 * - "server -i" reads one request per line from standard input and writes each response to standard output.
 * - "server port" listens on the TCP port and serves one request per connection, each connection on its own thread.
 * Both modes share a single ProtocolEngine for the lifetime of the process.
 */
public class Server {

    public static final String INTERACTIVE_OPTION = "-i";
    public static final String USAGE = "Usage: server -i | server <port>";
    public static final String INVALID_PORT = "Invalid port number.";

    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    private final ServerProperties properties;
    private final ProtocolEngine engine;

    public Server(ServerProperties properties) {
        if (properties == null) {
            throw new NullPointerException("properties must not be null");
        }
        this.properties = properties;
        this.engine = new ProtocolEngine(
                new RuleStore(),
                new RequestLog(properties.getRequestLogCapacity()),
                properties.getBufferSize());
    }

    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parses the command line and runs the selected mode.
     *
     * @return the process exit status: 0, or 1 for bad arguments or a port that cannot be listened on
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        if (args == null || args.length != 1) {
            err.println(USAGE);
            return 1;
        }
        Server server = new Server(ServerProperties.load());

        if (INTERACTIVE_OPTION.equals(args[0])) {
            try {
                server.runInteractive(new InputStreamReader(in, StandardCharsets.UTF_8),
                        new OutputStreamWriter(out, StandardCharsets.UTF_8));
                return 0;
            } catch (IOException e) {
                logger.error("Error reading requests: {}", e.getMessage(), e);
                return 1;
            }
        }

        // non-numeric text reads as 0 and is rejected below
        int port = NumberUtils.toInt(args[0], 0);
        if (port <= 0 || port > Specification.MAX_PORT) {
            err.println(INVALID_PORT);
            return 1;
        }
        try {
            server.startNetwork(port).awaitTermination();
            return 0;
        } catch (IOException e) {
            err.println(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    /**
     * Serves requests read line by line from the reader until end of input, writing each response followed by a
     * newline.  Runs entirely on the calling thread.
     */
    public void runInteractive(Reader requests, Writer responses) throws IOException {
        BufferedReader reader = new BufferedReader(requests);
        PrintWriter writer = new PrintWriter(responses);
        String line;
        while ((line = reader.readLine()) != null) {
            writer.println(engine.submit(line));
            writer.flush();
        }
        writer.flush();
    }

    /**
     * Starts listening on the given port (0 picks an ephemeral port) and returns immediately.
     *
     * @return the ServiceManager of the running service
     * @throws IOException if the port cannot be bound
     */
    public NetworkUtilities.ServiceManager startNetwork(int port) throws IOException {
        ServerProperties p = properties.withPort(port);
        NetworkUtilities networkUtilities = new SocketNetworkUtilities(p);
        NetworkUtilities.ServiceManager serviceManager =
                networkUtilities.registerService(new ConnectionHandler(engine, p.getBufferSize()));
        serviceManager.start();
        return serviceManager;
    }

    public ProtocolEngine getEngine() {
        return engine;
    }
}

package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.Specification.Firewall_Request_Commands;
import org.anarplex.lib.firewall.Specification.Firewall_Response;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * This class implements the firewall request protocol.  Each request is one line of text and is answered with one
 * block of text (list responses span several lines).  No state is kept between requests other than the shared
 * RuleStore and RequestLog.
 * A single engine is shared by every connection.  All request processing is serialized by the engine's lock, so that
 * each request is applied atomically with respect to all others.
 */
public class ProtocolEngine {

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private static final Logger logger = LoggerFactory.getLogger(ProtocolEngine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final RuleStore ruleStore;
    private final RequestLog requestLog;
    private final int maxResponseLength;
    private final CommandDispatcher dispatcher = new CommandDispatcher();

    public ProtocolEngine() {
        this(new RuleStore(), new RequestLog(), DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize size of the response buffer.  Responses are cut to bufferSize-1 characters.
     */
    public ProtocolEngine(RuleStore ruleStore, RequestLog requestLog, int bufferSize) {
        if (ruleStore != null && requestLog != null) {
            if (bufferSize < 2) {
                throw new IllegalArgumentException("bufferSize must be at least 2: " + bufferSize);
            }
            this.ruleStore = ruleStore;
            this.requestLog = requestLog;
            this.maxResponseLength = bufferSize - 1;
            setCommandHandlers(dispatcher);
        } else {
            throw new NullPointerException("ruleStore and requestLog must not be null");
        }
    }

    /**
     * Processes one request as a single transaction: acquires the engine's lock, processes the request and releases
     * the lock.  Safe to call from any number of threads.
     *
     * @param requestLine the request, with or without its line terminator
     * @return the response text
     */
    public String submit(String requestLine) {
        lock.lock();
        try {
            return processRequest(requestLine);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Processes one request.  The caller must hold the engine's lock (see {@link #getLock()}); {@link #submit(String)}
     * does that for you.
     * The trimmed request line is recorded in the RequestLog and then dispatched to the handler of its command.
     *
     * @return the response text, never null and never longer than the response buffer allows
     * @throws IllegalStateException if the calling thread does not hold the engine's lock
     */
    public String processRequest(String requestLine) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("processRequest requires the engine lock to be held by the calling thread");
        }
        String trimmed = StringUtils.strip(StringUtils.defaultString(requestLine));
        logger.info("Received request line: {}", trimmed);
        requestLog.record(trimmed);

        String response = StringUtils.truncate(dispatcher.applyHandler(trimmed), maxResponseLength);

        Firewall_Response fixed = Firewall_Response.findByText(response);
        if (fixed != null && fixed.isFailure()) {
            logger.warn("Sending response: {}", response);
        } else {
            logger.info("Sending response: {}", StringUtils.abbreviate(response, 80));
        }
        return response;
    }

    /**
     * The lock guarding every request.  Hold it while calling {@link #processRequest(String)} directly.
     */
    public ReentrantLock getLock() {
        return lock;
    }

    public RuleStore getRuleStore() {
        return ruleStore;
    }

    public RequestLog getRequestLog() {
        return requestLog;
    }

    private void setCommandHandlers(CommandDispatcher dispatcher) {
        dispatcher.clearHandlers();

        dispatcher.addHandler(Firewall_Request_Commands.ADD_RULE, this::handleAddRule);
        dispatcher.addHandler(Firewall_Request_Commands.CHECK_CONNECTION, this::handleCheckConnection);
        dispatcher.addHandler(Firewall_Request_Commands.DELETE_RULE, this::handleDeleteRule);
        dispatcher.addHandler(Firewall_Request_Commands.LIST_RULES, this::handleListRules);
        dispatcher.addHandler(Firewall_Request_Commands.LIST_REQUESTS, this::handleListRequests);
    }

    /*
     * --- Beginning of Command Handlers ---
     * Each handler receives the whitespace separated arguments that follow the command letter.
     */

    /**
     * A ip_range port_range
     * Arguments beyond the second are ignored.
     */
    protected String handleAddRule(String[] args) {
        if (args.length < 2) {
            return Firewall_Response.INVALID_RULE_FORMAT.getText();
        }
        return ruleStore.addRule(args[0], args[1]).getText();
    }

    /**
     * C ip port
     * The port must be a decimal integer.  Anything else is reported as an illegal address or port.
     */
    protected String handleCheckConnection(String[] args) {
        if (args.length < 2) {
            return Firewall_Response.ILLEGAL_ADDRESS_OR_PORT.getText();
        }
        int port;
        try {
            port = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            logger.debug("Port is not an integer: {}", args[1]);
            return Firewall_Response.ILLEGAL_ADDRESS_OR_PORT.getText();
        }
        return ruleStore.checkConnection(args[0], port).getText();
    }

    /**
     * D ip_range port_range
     */
    protected String handleDeleteRule(String[] args) {
        if (args.length < 2) {
            return Firewall_Response.INVALID_RULE_FORMAT.getText();
        }
        return ruleStore.deleteRule(args[0], args[1]).getText();
    }

    protected String handleListRules(String[] args) {
        return ruleStore.listRules();
    }

    protected String handleListRequests(String[] args) {
        return requestLog.list();
    }

    /*
     * --- End of Command Handlers ---
     */


    /**
     * CommandDispatcher maintains an internal map of request commands to their respective handlers.
     */
    static private class CommandDispatcher {

        void clearHandlers() {
            handlers.clear();
        }

        /**
         * Adds the supplied handler and replaces an existing handler already associated with the same command.
         */
        private void addHandler(Firewall_Request_Commands name, Function<String[], String> func) {
            handlers.put(name, func);
        }

        private String applyHandler(String requestLine) {
            Firewall_Request_Commands command = Firewall_Request_Commands.getCommand(requestLine);
            if (command != null) {
                Function<String[], String> handler = handlers.get(command);
                if (handler != null) {
                    String[] args = command.takesArguments()
                            ? StringUtils.split(requestLine.substring(command.getValue().length()))
                            : new String[0];
                    return handler.apply(args);
                }
                logger.warn("No handler registered for command {}", command);
            }
            return Firewall_Response.ILLEGAL_REQUEST.getText();
        }

        private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

        private final EnumMap<Firewall_Request_Commands, Function<String[], String>> handlers = new EnumMap<>(Firewall_Request_Commands.class);
    }
}

package org.anarplex.lib.firewall;

import java.util.Arrays;
import java.util.Comparator;

public class Specification {

    private Specification() {
        super();
    }

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Specification.class);

    public static final String LF = "\n";
    public static final String ARGUMENT_SEPARATOR = " ";
    public static final String RANGE_SEPARATOR = "-";

    public static final int MIN_PORT = 0;
    public static final int MAX_PORT = 65535;

    /*
     * Firewall request commands.  Every request is a single line whose first character selects the command.
     * A: Adds a rule for an IP range and a port range.
     * C: Checks whether a connection from an IP address to a port is accepted by any rule.
     * D: Deletes the rule with exactly the given IP range and port range.
     * L: Lists every rule followed by the connections it has accepted.
     * R: Lists the request lines received so far.
     * Commands that take arguments are followed by a single space.  Commands without arguments must be the whole line.
     */
    public enum Firewall_Request_Commands {
        ADD_RULE("A", true),
        CHECK_CONNECTION("C", true),
        DELETE_RULE("D", true),
        LIST_RULES("L", false),
        LIST_REQUESTS("R", false);

        Firewall_Request_Commands(String value, boolean takesArguments) {
            this.value = value;
            this.takesArguments = takesArguments;
        }

        /**
         * Return the Command selected by the supplied (already trimmed) request line, or null if the line does not
         * name a known command.  Matching is case-sensitive.
         */
        static public Firewall_Request_Commands getCommand(String requestLine) {
            if (requestLine == null) {
                return null;
            }
            for (Firewall_Request_Commands command : sortedValues) {
                if (command.takesArguments) {
                    if (requestLine.startsWith(command.value + ARGUMENT_SEPARATOR)) {
                        return command;
                    }
                } else if (requestLine.equals(command.value)) {
                    return command;
                }
            }
            return null;
        }

        public String getValue() { return value; }
        public boolean takesArguments() { return takesArguments; }
        public String toString() { return getValue(); }

        // longest command first, so that a future multi-letter command is never shadowed by its one-letter prefix
        private static final Firewall_Request_Commands[] sortedValues;
        static {
            sortedValues = Arrays.stream(Firewall_Request_Commands.values())
                    .sorted(Comparator.comparingInt((Firewall_Request_Commands c) -> c.getValue().length()).reversed())
                    .toArray(Firewall_Request_Commands[]::new);
        }

        private final String value;
        private final boolean takesArguments;
    }

    /**
     * Every fixed response text of the protocol.  The listings (L and R) are built from the RULE_LINE and QUERY_LINE
     * formats, or answer with NO_RULES / NO_REQUESTS when there is nothing to list.
     * Note that ADD_RULE rejects a bad rule with "Invalid rule" while DELETE_RULE answers "Rule invalid".  Clients
     * rely on the distinction.
     */
    public enum Firewall_Response {
        RULE_ADDED("Rule added", false),
        RULE_EXISTS("Rule already exists", true),
        INVALID_RULE("Invalid rule", true),
        INVALID_RULE_FORMAT("Invalid rule format", true),
        CONNECTION_ACCEPTED("Connection accepted", false),
        CONNECTION_REJECTED("Connection rejected", false),
        ILLEGAL_ADDRESS_OR_PORT("Illegal IP address or port specified", true),
        RULE_DELETED("Rule deleted", false),
        RULE_NOT_FOUND("Rule not found", true),
        RULE_INVALID("Rule invalid", true),
        NO_RULES("No rules found", false),
        NO_REQUESTS("No requests found", false),
        ILLEGAL_REQUEST("Illegal request", true);

        public static final String RULE_LINE = "Rule: %s %s";
        public static final String QUERY_LINE = "Query: %s %d";

        private final String text;
        private final boolean failure;

        Firewall_Response(String text, boolean failure) {
            this.text = text;
            this.failure = failure;
        }

        public String getText() {
            return text;
        }

        /**
         * @return true if this response reports a request the server refused to act on
         */
        public boolean isFailure() {
            return failure;
        }

        public String toString() {
            return text;
        }

        public static Firewall_Response findByText(String text) {
            for (Firewall_Response r : Firewall_Response.values()) {
                if (r.text.equals(text)) {
                    return r;
                }
            }
            logger.debug("Firewall_Response.findByText: not a fixed response: {}", text);
            return null;
        }
    }
}

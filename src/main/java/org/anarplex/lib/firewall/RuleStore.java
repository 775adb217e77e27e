package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.Specification.Firewall_Response;
import org.anarplex.lib.firewall.utils.RangeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * RuleStore holds the firewall rules in the order they were added.  Every rule keeps the history of the connections
 * it accepted.  When several rules would accept a connection, only the earliest added one accepts it and records it.
 * This class is NOT thread-safe.  The ProtocolEngine serializes every access through its lock.
 */
public class RuleStore {

    private static final Logger logger = LoggerFactory.getLogger(RuleStore.class);

    /**
     * A connection attempt that was accepted by a rule.
     */
    public record Query(String ip, int port) {
    }

    /**
     * A firewall rule: an IP range and a port range, plus the connections it has accepted so far (oldest first).
     * Rules are identified by the exact text of their two ranges.
     */
    public static class Rule {
        private final String ipRange;
        private final String portRange;
        private final List<Query> queries = new ArrayList<>();

        Rule(String ipRange, String portRange) {
            this.ipRange = ipRange;
            this.portRange = portRange;
        }

        public String getIpRange() {
            return ipRange;
        }

        public String getPortRange() {
            return portRange;
        }

        public List<Query> getQueries() {
            return Collections.unmodifiableList(queries);
        }

        boolean matches(String ip, int port) {
            return RangeMatcher.addressInRange(ip, ipRange) && RangeMatcher.portInRange(port, portRange);
        }

        boolean hasRanges(String ipRange, String portRange) {
            return this.ipRange.equals(ipRange) && this.portRange.equals(portRange);
        }

        void addQuery(String ip, int port) {
            queries.add(new Query(ip, port));
        }

        @Override
        public String toString() {
            return String.format(Firewall_Response.RULE_LINE, ipRange, portRange);
        }
    }

    private final List<Rule> rules = new ArrayList<>();

    /**
     * Adds a new rule with an empty history.
     *
     * @return RULE_ADDED, or INVALID_RULE if either range is malformed, or RULE_EXISTS if a rule with exactly the
     * same ranges is already present
     */
    public Firewall_Response addRule(String ipRange, String portRange) {
        if (!RangeMatcher.isValidAddressRange(ipRange) || !RangeMatcher.isValidPortRange(portRange)) {
            return Firewall_Response.INVALID_RULE;
        }
        if (findRule(ipRange, portRange) != null) {
            return Firewall_Response.RULE_EXISTS;
        }
        rules.add(new Rule(ipRange, portRange));
        logger.debug("Added rule {} {} ({} rules)", ipRange, portRange, rules.size());
        return Firewall_Response.RULE_ADDED;
    }

    /**
     * Checks a connection against the rules in the order they were added.  The first matching rule records the
     * connection in its history.
     *
     * @return CONNECTION_ACCEPTED or CONNECTION_REJECTED, or ILLEGAL_ADDRESS_OR_PORT if the ip is not a single valid
     * address or the port is outside 0-65535 (in which case nothing is recorded)
     */
    public Firewall_Response checkConnection(String ip, int port) {
        if (!RangeMatcher.isValidAddress(ip) || !RangeMatcher.isValidPort(port)) {
            return Firewall_Response.ILLEGAL_ADDRESS_OR_PORT;
        }
        for (Rule rule : rules) {
            if (rule.matches(ip, port)) {
                rule.addQuery(ip, port);
                return Firewall_Response.CONNECTION_ACCEPTED;
            }
        }
        return Firewall_Response.CONNECTION_REJECTED;
    }

    /**
     * Removes the rule with exactly the given ranges, together with its history.  The remaining rules keep their
     * relative order.
     *
     * @return RULE_DELETED, or RULE_INVALID if either range is malformed, or RULE_NOT_FOUND
     */
    public Firewall_Response deleteRule(String ipRange, String portRange) {
        if (!RangeMatcher.isValidAddressRange(ipRange) || !RangeMatcher.isValidPortRange(portRange)) {
            return Firewall_Response.RULE_INVALID;
        }
        Iterator<Rule> it = rules.iterator();
        while (it.hasNext()) {
            if (it.next().hasRanges(ipRange, portRange)) {
                it.remove();
                logger.debug("Deleted rule {} {} ({} rules)", ipRange, portRange, rules.size());
                return Firewall_Response.RULE_DELETED;
            }
        }
        return Firewall_Response.RULE_NOT_FOUND;
    }

    /**
     * Lists every rule ("Rule: ip_range port_range") each followed by its history ("Query: ip port"), one entry per
     * line.
     *
     * @return the listing, or "No rules found" if the store is empty
     */
    public String listRules() {
        if (rules.isEmpty()) {
            return Firewall_Response.NO_RULES.getText();
        }
        List<String> lines = new ArrayList<>();
        for (Rule rule : rules) {
            lines.add(rule.toString());
            for (Query q : rule.queries) {
                lines.add(String.format(Firewall_Response.QUERY_LINE, q.ip(), q.port()));
            }
        }
        return String.join(Specification.LF, lines);
    }

    /**
     * @return a read-only view of the rules, in the order they were added
     */
    public List<Rule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public int size() {
        return rules.size();
    }

    private Rule findRule(String ipRange, String portRange) {
        return rules.stream()
                .filter(r -> r.hasRanges(ipRange, portRange))
                .findFirst()
                .orElse(null);
    }
}

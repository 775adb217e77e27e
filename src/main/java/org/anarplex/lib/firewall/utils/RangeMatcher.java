package org.anarplex.lib.firewall.utils;

import org.anarplex.lib.firewall.Specification;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * RangeMatcher validates IPv4 address ranges and port ranges, and tests whether an address or a port falls within
 * such a range.
 * Range syntax:
 * - an address range is either a single dotted-quad address "A.B.C.D" or "A.B.C.D-E.F.G.H"
 * - a port range is either a single port "N" or "N-M"
 * Both kinds of range are inclusive at both ends.  Ranges are split on their first '-'.
 * Examples:
 * - "10.0.0.1-10.0.0.10" contains "10.0.0.1", "10.0.0.5" and "10.0.0.10" but not "10.0.0.11"
 * - "8000-8010" contains 8000 and 8010 but not 8011
 * Port bounds are parsed permissively: text that is not a decimal integer reads as port 0.  A number too large for
 * an int is still a number and is out of range.
 */
public final class RangeMatcher {

    private static final int OCTETS = 4;
    private static final int MAX_OCTET = 255;
    private static final int MAX_OCTET_DIGITS = 3;
    private static final String DECIMAL_DIGITS = "0123456789";

    private RangeMatcher() {
    }

    /**
     * Thrown when a string is not a dotted-quad IPv4 address.
     */
    public static class InvalidFormatException extends Exception {
        public InvalidFormatException(String message) {
            super(message);
        }
    }

    /**
     * Converts a dotted-quad IPv4 address into its unsigned 32-bit value, most significant octet first.
     * Exactly four decimal octets are required, each 0-255 and without leading zeros.  Host names and IPv6
     * addresses are rejected.
     *
     * @param address the address text, e.g. "192.168.1.10"
     * @return the address as a value in the range 0 to 2^32-1
     * @throws InvalidFormatException if the text is not a dotted-quad IPv4 address
     */
    public static long parseIPv4(String address) throws InvalidFormatException {
        if (address == null || address.isEmpty()) {
            throw new InvalidFormatException("IP address cannot be null or empty");
        }
        String[] octets = address.split("\\.", -1);
        if (octets.length != OCTETS) {
            throw new InvalidFormatException("IP address must have exactly 4 octets: " + address);
        }
        long value = 0;
        for (String octet : octets) {
            value = (value << 8) | parseOctet(octet, address);
        }
        return value;
    }

    private static int parseOctet(String octet, String address) throws InvalidFormatException {
        if (octet.isEmpty() || octet.length() > MAX_OCTET_DIGITS || !StringUtils.containsOnly(octet, DECIMAL_DIGITS)) {
            throw new InvalidFormatException("IP octet must be 1 to 3 decimal digits: " + address);
        }
        // "010" could be read as octal elsewhere
        if (octet.length() > 1 && octet.charAt(0) == '0') {
            throw new InvalidFormatException("IP octet cannot have leading zeros: " + address);
        }
        int value = Integer.parseInt(octet);
        if (value > MAX_OCTET) {
            throw new InvalidFormatException("IP octet must be 0-255: " + address);
        }
        return value;
    }

    public static boolean isValidAddress(String address) {
        try {
            parseIPv4(address);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    /**
     * An address range is valid when both of its ends are valid addresses.  The ends are not required to be in
     * ascending order; an inverted range is valid but contains nothing.
     */
    public static boolean isValidAddressRange(String range) {
        if (range == null) {
            return false;
        }
        if (!range.contains(Specification.RANGE_SEPARATOR)) {
            return isValidAddress(range);
        }
        return isValidAddress(lowerBound(range)) && isValidAddress(upperBound(range));
    }

    /**
     * A single port is valid in 0-65535.  A range "p-q" additionally needs p strictly less than q, so "80-80" is
     * rejected while the single port "80" is accepted.
     */
    public static boolean isValidPortRange(String range) {
        if (range == null) {
            return false;
        }
        if (!range.contains(Specification.RANGE_SEPARATOR)) {
            return isValidPort(parsePort(range));
        }
        long start = parsePort(lowerBound(range));
        long end = parsePort(upperBound(range));
        return start >= Specification.MIN_PORT && end <= Specification.MAX_PORT && start < end;
    }

    public static boolean isValidPort(int port) {
        return isValidPort((long) port);
    }

    private static boolean isValidPort(long port) {
        return port >= Specification.MIN_PORT && port <= Specification.MAX_PORT;
    }

    /**
     * Tests whether the address lies in the (inclusive) range.  Addresses are compared as unsigned 32-bit values;
     * a range whose start is above its end contains nothing.  An unparseable address or range never matches.
     */
    public static boolean addressInRange(String address, String range) {
        if (range == null) {
            return false;
        }
        try {
            long value = parseIPv4(address);
            if (!range.contains(Specification.RANGE_SEPARATOR)) {
                return value == parseIPv4(range);
            }
            long start = parseIPv4(lowerBound(range));
            long end = parseIPv4(upperBound(range));
            return value >= start && value <= end;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    public static boolean portInRange(int port, String range) {
        if (range == null) {
            return false;
        }
        if (!range.contains(Specification.RANGE_SEPARATOR)) {
            return port == parsePort(range);
        }
        return port >= parsePort(lowerBound(range)) && port <= parsePort(upperBound(range));
    }

    /**
     * Reads a port bound.  Anything that is not a decimal integer (including the empty string) reads as 0.  A run of
     * digits too long for a long reads as Long.MAX_VALUE, so it stays out of range.
     */
    static long parsePort(String bound) {
        if (StringUtils.isNotEmpty(bound) && StringUtils.containsOnly(bound, DECIMAL_DIGITS)) {
            return NumberUtils.toLong(bound, Long.MAX_VALUE);
        }
        return NumberUtils.toInt(bound, 0);
    }

    private static String lowerBound(String range) {
        return StringUtils.substringBefore(range, Specification.RANGE_SEPARATOR);
    }

    private static String upperBound(String range) {
        return StringUtils.substringAfter(range, Specification.RANGE_SEPARATOR);
    }
}

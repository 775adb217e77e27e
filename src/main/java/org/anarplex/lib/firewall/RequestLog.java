package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.Specification.Firewall_Request_Commands;
import org.anarplex.lib.firewall.Specification.Firewall_Response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RequestLog keeps the request lines received by the server, oldest first.  Once it holds its capacity of lines it
 * stops recording; earlier lines are never evicted.  The request that lists the log (R) is itself never recorded.
 * This class is NOT thread-safe.
 */
public class RequestLog {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final List<String> requests = new ArrayList<>();

    public RequestLog() {
        this(DEFAULT_CAPACITY);
    }

    public RequestLog(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Records the (trimmed) request line unless the log is full or the line is the list-requests command.
     *
     * @return true if the line was recorded
     */
    public boolean record(String requestLine) {
        if (requests.size() >= capacity || Firewall_Request_Commands.LIST_REQUESTS.getValue().equals(requestLine)) {
            return false;
        }
        requests.add(requestLine);
        return true;
    }

    /**
     * @return the recorded lines, one per line, or "No requests found" if nothing has been recorded
     */
    public String list() {
        if (requests.isEmpty()) {
            return Firewall_Response.NO_REQUESTS.getText();
        }
        return String.join(Specification.LF, requests);
    }

    public List<String> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public int size() {
        return requests.size();
    }

    public int getCapacity() {
        return capacity;
    }
}

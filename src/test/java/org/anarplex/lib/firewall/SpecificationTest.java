package org.anarplex.lib.firewall;

import org.anarplex.lib.firewall.Specification.Firewall_Request_Commands;
import org.anarplex.lib.firewall.Specification.Firewall_Response;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpecificationTest {

    @Test
    void testGetCommand() {
        assertEquals(Firewall_Request_Commands.ADD_RULE, Firewall_Request_Commands.getCommand("A 1.2.3.4 80"));
        assertEquals(Firewall_Request_Commands.CHECK_CONNECTION, Firewall_Request_Commands.getCommand("C x"));
        assertEquals(Firewall_Request_Commands.DELETE_RULE, Firewall_Request_Commands.getCommand("D "));
        assertEquals(Firewall_Request_Commands.LIST_RULES, Firewall_Request_Commands.getCommand("L"));
        assertEquals(Firewall_Request_Commands.LIST_REQUESTS, Firewall_Request_Commands.getCommand("R"));
    }

    @Test
    void testUnknownCommands() {
        assertNull(Firewall_Request_Commands.getCommand(null));
        assertNull(Firewall_Request_Commands.getCommand(""));
        assertNull(Firewall_Request_Commands.getCommand("A"));
        assertNull(Firewall_Request_Commands.getCommand("l"));
        assertNull(Firewall_Request_Commands.getCommand("L "));
        assertNull(Firewall_Request_Commands.getCommand("RL"));
        assertNull(Firewall_Request_Commands.getCommand("Add 1.2.3.4 80"));
    }

    @Test
    void testResponses() {
        assertEquals("Invalid rule", Firewall_Response.INVALID_RULE.getText());
        assertEquals("Rule invalid", Firewall_Response.RULE_INVALID.getText());
        assertTrue(Firewall_Response.RULE_EXISTS.isFailure());
        assertFalse(Firewall_Response.CONNECTION_REJECTED.isFailure());
        assertEquals(Firewall_Response.RULE_NOT_FOUND, Firewall_Response.findByText("Rule not found"));
        assertNull(Firewall_Response.findByText("Rule: 10.0.0.1 80"));
    }
}

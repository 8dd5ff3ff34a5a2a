package com.example.securitycore.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.securitycore.config.MiddlewareProperties;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IpAccessListTest {

    @Test
    @DisplayName("Deny list wins; an empty allow list lets everyone else in")
    void staticLists() {
        MiddlewareProperties props = new MiddlewareProperties();
        props.getIp().setDenyList(List.of("203.0.113.5"));
        IpAccessList list = new IpAccessList(props);

        assertFalse(list.isAllowed("203.0.113.5"));
        assertTrue(list.isAllowed("198.51.100.1"));

        props.getIp().setAllowList(List.of("198.51.100.1"));
        assertTrue(list.isAllowed("198.51.100.1"));
        assertFalse(list.isAllowed("198.51.100.2"));
    }

    @Test
    @DisplayName("Repeated violations block the address once")
    void autoBlock() {
        MiddlewareProperties props = new MiddlewareProperties();
        props.getIp().setAutoBlockThreshold(3);
        IpAccessList list = new IpAccessList(props);

        assertFalse(list.recordViolation("10.0.0.7"));
        assertFalse(list.recordViolation("10.0.0.7"));
        assertTrue(list.isAllowed("10.0.0.7"));
        assertTrue(list.recordViolation("10.0.0.7"));
        assertFalse(list.recordViolation("10.0.0.7"));

        assertFalse(list.isAllowed("10.0.0.7"));
        assertEquals(4, list.violationCount("10.0.0.7"));
        assertTrue(list.isAllowed("10.0.0.8"));
    }

    @Test
    @DisplayName("CIDR entries cover every address under their prefix")
    void cidrBlocks() {
        MiddlewareProperties props = new MiddlewareProperties();
        props.getIp().setDenyList(List.of("203.0.113.0/24", "2001:db8::/32"));
        props.getIp().setAllowList(List.of("10.0.0.0/8", "192.168.1.128/25", "203.0.113.0/16"));
        IpAccessList list = new IpAccessList(props);

        assertTrue(list.isAllowed("10.255.3.4"));
        assertTrue(list.isAllowed("192.168.1.200"));
        assertFalse(list.isAllowed("192.168.1.127"));
        assertFalse(list.isAllowed("11.0.0.1"));
        assertFalse(list.isAllowed("203.0.113.9"));
        assertFalse(list.isAllowed("2001:db8:1::5"));
        assertFalse(list.isAllowed("not-an-address"));
    }

    @Test
    @DisplayName("Malformed entries are rejected when the list is built")
    void malformedEntries() {
        MiddlewareProperties prefix = new MiddlewareProperties();
        prefix.getIp().setDenyList(List.of("10.0.0.0/33"));
        MiddlewareProperties host = new MiddlewareProperties();
        host.getIp().setAllowList(List.of("intranet.example"));

        assertThrows(IllegalArgumentException.class, () -> new IpAccessList(prefix));
        assertThrows(IllegalArgumentException.class, () -> new IpAccessList(host));
    }
}

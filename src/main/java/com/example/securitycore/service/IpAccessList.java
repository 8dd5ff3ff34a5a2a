package com.example.securitycore.service;

import com.example.securitycore.config.MiddlewareProperties;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Static allow and deny lists from configuration plus addresses blocked at runtime after
 * repeated violations. List entries are single addresses or CIDR blocks such as
 * {@code 10.0.0.0/8} or {@code 2001:db8::/32}.
 */
@Service
@Slf4j
public class IpAccessList {

    // literals only, so matching never triggers a DNS lookup
    private static final Pattern ADDRESS_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+");

    private final MiddlewareProperties.IpFilter properties;
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> violations = new ConcurrentHashMap<>();
    private final Map<String, Block> parsed = new ConcurrentHashMap<>();

    public IpAccessList(MiddlewareProperties middlewareProperties) {
        this.properties = middlewareProperties.getIp();
        properties.getDenyList().forEach(this::block);
        properties.getAllowList().forEach(this::block);
    }

    public boolean isAllowed(String ip) {
        if (blocked.contains(ip)) {
            return false;
        }
        byte[] address = parseAddress(ip);
        if (matchesAny(properties.getDenyList(), ip, address)) {
            return false;
        }
        return properties.getAllowList().isEmpty() || matchesAny(properties.getAllowList(), ip, address);
    }

    /**
     * Counts a violation against {@code ip}.
     *
     * @return true if this violation crossed the auto-block threshold
     */
    public boolean recordViolation(String ip) {
        int count = violations.computeIfAbsent(ip, k -> new AtomicInteger()).incrementAndGet();
        if (count >= properties.getAutoBlockThreshold() && blocked.add(ip)) {
            log.warn("Blocking IP {} after {} security violations", ip, count);
            return true;
        }
        return false;
    }

    public int violationCount(String ip) {
        AtomicInteger count = violations.get(ip);
        return count == null ? 0 : count.get();
    }

    private boolean matchesAny(List<String> entries, String ip, byte[] address) {
        for (String entry : entries) {
            if (entry.equals(ip) || (address != null && block(entry).contains(address))) {
                return true;
            }
        }
        return false;
    }

    private Block block(String entry) {
        return parsed.computeIfAbsent(entry, Block::parse);
    }

    private static byte[] parseAddress(String literal) {
        if (literal == null || !ADDRESS_LITERAL.matcher(literal).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException ex) {
            return null;
        }
    }

    private record Block(byte[] network, int prefixLength) {

        static Block parse(String entry) {
            int slash = entry.indexOf('/');
            String host = slash < 0 ? entry : entry.substring(0, slash);
            byte[] network = parseAddress(host);
            if (network == null) {
                throw new IllegalArgumentException("Not an IP address or CIDR block: " + entry);
            }
            int bits = network.length * 8;
            int prefix = bits;
            if (slash >= 0) {
                try {
                    prefix = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Bad prefix length in " + entry, ex);
                }
                if (prefix < 0 || prefix > bits) {
                    throw new IllegalArgumentException("Prefix length out of range in " + entry);
                }
            }
            return new Block(network, prefix);
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int whole = prefixLength / 8;
            for (int i = 0; i < whole; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int rest = prefixLength % 8;
            if (rest == 0) {
                return true;
            }
            int mask = 0xFF << (8 - rest);
            return (address[whole] & mask) == (network[whole] & mask);
        }
    }
}

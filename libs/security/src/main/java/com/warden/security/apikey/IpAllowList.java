package com.warden.security.apikey;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Matches client addresses against an API key's allow-list entries: exact addresses,
 * {@code *}, and CIDR blocks such as {@code 10.0.0.0/8} or {@code 2001:db8::/32}.
 */
final class IpAllowList {

    private static final String ANY = "*";

    // literals only, so parsing never triggers a DNS lookup
    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6_LITERAL = Pattern.compile("[0-9A-Fa-f:.]*:[0-9A-Fa-f:.]*");

    private IpAllowList() {
        // utility class
    }

    /**
     * @return true when the list is empty or any entry matches
     */
    static boolean isAllowed(String ipAddress, Collection<String> allowed) {
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        if (ipAddress == null || ipAddress.isBlank()) {
            return false;
        }
        String address = ipAddress.strip();
        for (String entry : allowed) {
            if (entry == null) {
                continue;
            }
            String candidate = entry.strip();
            if (candidate.equals(ANY) || candidate.equals(address)) {
                return true;
            }
            if (candidate.indexOf('/') > 0 && inCidr(address, candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean inCidr(String address, String cidr) {
        int slash = cidr.indexOf('/');
        String network = cidr.substring(0, slash);
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            return false;
        }
        byte[] addressBytes = parse(address);
        byte[] networkBytes = parse(network);
        if (addressBytes == null || networkBytes == null || addressBytes.length != networkBytes.length) {
            return false;
        }
        if (prefixLength < 0 || prefixLength > addressBytes.length * 8) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (addressBytes[i] != networkBytes[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (addressBytes[fullBytes] & mask) == (networkBytes[fullBytes] & mask);
    }

    private static byte[] parse(String literal) {
        if (!IPV4_LITERAL.matcher(literal).matches() && !IPV6_LITERAL.matcher(literal).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}

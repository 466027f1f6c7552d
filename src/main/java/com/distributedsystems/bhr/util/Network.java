package com.distributedsystems.bhr.util;

import com.distributedsystems.bhr.exception.InvalidNetworkException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable CIDR network: an IPv4 or IPv6 base address plus prefix length.
 *
 * <p>Instances are always normalized. A bare address parses to a single-host
 * prefix ({@code /32} or {@code /128}); text whose host bits are set beyond the
 * prefix is rejected rather than silently masked. Two networks are equal only
 * when family, address bytes and prefix length all match, so a /24 and one of
 * its /32 hosts are never equal.</p>
 */
public final class Network {

    private static final int IPV4_BYTES = 4;
    private static final int IPV6_BYTES = 16;

    private final byte[] address;
    private final int prefixLength;
    private final String text;

    private Network(byte[] address, int prefixLength) {
        this.address = address;
        this.prefixLength = prefixLength;
        this.text = render(address, prefixLength);
    }

    public static Network parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidNetworkException(input, "empty network");
        }
        String value = input.trim();
        int slash = value.indexOf('/');
        String addressPart = slash < 0 ? value : value.substring(0, slash);
        byte[] bytes = parseAddress(input, addressPart);
        int maxPrefix = bytes.length * 8;

        int prefix = maxPrefix;
        if (slash >= 0) {
            String prefixPart = value.substring(slash + 1);
            if (prefixPart.isEmpty() || prefixPart.length() > 3 || !isDecimal(prefixPart)) {
                throw new InvalidNetworkException(input, "bad prefix length");
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > maxPrefix) {
                throw new InvalidNetworkException(input, "prefix length out of range");
            }
        }
        if (!Arrays.equals(bytes, mask(bytes, prefix))) {
            throw new InvalidNetworkException(input, "host bits set beyond /" + prefix);
        }
        return new Network(bytes, prefix);
    }

    /**
     * True when every address of {@code inner} also lies in {@code outer}.
     * Networks of different address families never contain each other.
     */
    public static boolean contains(Network outer, Network inner) {
        return outer.contains(inner);
    }

    public boolean contains(Network inner) {
        if (inner == null || inner.address.length != address.length) {
            return false;
        }
        if (inner.prefixLength < prefixLength) {
            return false;
        }
        return Arrays.equals(address, mask(inner.address, prefixLength));
    }

    public boolean isIpv4() {
        return address.length == IPV4_BYTES;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public boolean isSingleHost() {
        return prefixLength == address.length * 8;
    }

    public String toText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Network other)) return false;
        return prefixLength == other.prefixLength && Arrays.equals(address, other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(address), prefixLength);
    }

    @Override
    public String toString() {
        return text;
    }

    private static byte[] mask(byte[] bytes, int prefix) {
        byte[] out = new byte[bytes.length];
        int bits = prefix;
        for (int i = 0; i < bytes.length && bits > 0; i++) {
            if (bits >= 8) {
                out[i] = bytes[i];
                bits -= 8;
            } else {
                out[i] = (byte) (bytes[i] & (0xFF << (8 - bits)));
                bits = 0;
            }
        }
        return out;
    }

    private static byte[] parseAddress(String input, String addressPart) {
        if (addressPart.indexOf(':') >= 0) {
            return parseIpv6(input, addressPart);
        }
        byte[] v4 = parseIpv4(addressPart);
        if (v4 == null) {
            throw new InvalidNetworkException(input, "not an IPv4 or IPv6 address");
        }
        return v4;
    }

    private static byte[] parseIpv4(String text) {
        String[] parts = text.split("\\.", -1);
        if (parts.length != IPV4_BYTES) {
            return null;
        }
        byte[] out = new byte[IPV4_BYTES];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !isDecimal(part)) {
                return null;
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return null;
            }
            out[i] = (byte) octet;
        }
        return out;
    }

    private static byte[] parseIpv6(String input, String text) {
        byte[] embeddedV4 = null;
        String hexPart = text;
        int lastColon = text.lastIndexOf(':');
        if (text.indexOf('.', lastColon) >= 0) {
            embeddedV4 = parseIpv4(text.substring(lastColon + 1));
            if (embeddedV4 == null) {
                throw new InvalidNetworkException(input, "bad embedded IPv4 address");
            }
            hexPart = text.substring(0, lastColon + 1) + "0:0";
        }

        int doubleColon = hexPart.indexOf("::");
        if (doubleColon >= 0 && hexPart.indexOf("::", doubleColon + 1) >= 0) {
            throw new InvalidNetworkException(input, "more than one '::'");
        }

        String[] head;
        String[] tail;
        if (doubleColon >= 0) {
            head = splitGroups(hexPart.substring(0, doubleColon));
            tail = splitGroups(hexPart.substring(doubleColon + 2));
            if (head.length + tail.length > 7) {
                throw new InvalidNetworkException(input, "too many IPv6 groups");
            }
        } else {
            head = splitGroups(hexPart);
            tail = new String[0];
            if (head.length != 8) {
                throw new InvalidNetworkException(input, "IPv6 address needs 8 groups");
            }
        }

        int[] groups = new int[8];
        for (int i = 0; i < head.length; i++) {
            groups[i] = parseGroup(input, head[i]);
        }
        for (int i = 0; i < tail.length; i++) {
            groups[8 - tail.length + i] = parseGroup(input, tail[i]);
        }

        byte[] out = new byte[IPV6_BYTES];
        for (int i = 0; i < 8; i++) {
            out[i * 2] = (byte) (groups[i] >> 8);
            out[i * 2 + 1] = (byte) groups[i];
        }
        if (embeddedV4 != null) {
            System.arraycopy(embeddedV4, 0, out, 12, IPV4_BYTES);
        }
        return out;
    }

    private static boolean isDecimal(String s) {
        return s.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static String[] splitGroups(String s) {
        return s.isEmpty() ? new String[0] : s.split(":", -1);
    }

    private static int parseGroup(String input, String group) {
        if (group.isEmpty() || group.length() > 4) {
            throw new InvalidNetworkException(input, "bad IPv6 group '" + group + "'");
        }
        for (int i = 0; i < group.length(); i++) {
            char c = group.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) {
                throw new InvalidNetworkException(input, "bad IPv6 group '" + group + "'");
            }
        }
        return Integer.parseInt(group, 16);
    }

    private static String render(byte[] bytes, int prefix) {
        StringBuilder sb = new StringBuilder();
        if (bytes.length == IPV4_BYTES) {
            for (int i = 0; i < bytes.length; i++) {
                if (i > 0) sb.append('.');
                sb.append(bytes[i] & 0xFF);
            }
        } else {
            appendIpv6(sb, bytes);
        }
        return sb.append('/').append(prefix).toString();
    }

    // RFC 5952: lower-case hex, longest run (>= 2) of zero groups collapsed, first run wins ties.
    private static void appendIpv6(StringBuilder sb, byte[] bytes) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[i * 2] & 0xFF) << 8) | (bytes[i * 2 + 1] & 0xFF);
        }
        int bestStart = -1;
        int bestLen = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < 8 && groups[j] == 0) j++;
            if (j - i > bestLen) {
                bestStart = i;
                bestLen = j - i;
            }
            i = j;
        }
        if (bestLen < 2) {
            bestStart = -1;
        }
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLen - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
    }
}

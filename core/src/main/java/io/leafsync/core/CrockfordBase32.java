// file: src/main/java/io/leafsync/core/CrockfordBase32.java
package io.leafsync.core;

import java.io.ByteArrayOutputStream;

/**
 * Crockford base32 without padding or check symbol.
 * <p>
 * Encoding emits upper-case symbols; callers lower-case it where a canonical
 * lower-case form is wanted. Decoding is case-insensitive and maps the usual
 * look-alikes (O -> 0, I/L -> 1). Trailing bits that do not fill a byte are dropped.
 */
public final class CrockfordBase32 {
    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int[] LOOKUP = new int[128];

    static {
        java.util.Arrays.fill(LOOKUP, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            LOOKUP[ALPHABET[i]] = i;
            LOOKUP[Character.toLowerCase(ALPHABET[i])] = i;
        }
        LOOKUP['O'] = 0; LOOKUP['o'] = 0;
        LOOKUP['I'] = 1; LOOKUP['i'] = 1;
        LOOKUP['L'] = 1; LOOKUP['l'] = 1;
    }

    private CrockfordBase32() {
        // utility
    }

    public static String encode(byte[] data) {
        var out = new StringBuilder((data.length * 8 + 4) / 5);
        int buffer = 0;
        int bits = 0;
        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                out.append(ALPHABET[(buffer >>> (bits - 5)) & 31]);
                bits -= 5;
            }
        }
        if (bits > 0) {
            out.append(ALPHABET[(buffer << (5 - bits)) & 31]);
        }
        return out.toString();
    }

    /**
     * @throws IllegalArgumentException on a symbol outside the Crockford alphabet.
     */
    public static byte[] decode(String text) {
        var out = new ByteArrayOutputStream(text.length() * 5 / 8);
        int buffer = 0;
        int bits = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int v = c < 128 ? LOOKUP[c] : -1;
            if (v < 0) throw new IllegalArgumentException("invalid base32 character '" + c + "' at " + i);
            buffer = (buffer << 5) | v;
            bits += 5;
            if (bits >= 8) {
                out.write((buffer >>> (bits - 8)) & 0xFF);
                bits -= 8;
            }
        }
        return out.toByteArray();
    }
}

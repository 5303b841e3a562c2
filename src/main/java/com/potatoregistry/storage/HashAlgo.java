package com.potatoregistry.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public enum HashAlgo {
    SHA1("SHA-1", 40),
    SHA256("SHA-256", 64);

    public final String jcaName;
    public final int hexLen;
    HashAlgo(String jcaName, int hexLen) { this.jcaName = jcaName; this.hexLen = hexLen; }

    public static HashAlgo of(String s) {
        return switch (s.trim().toUpperCase(Locale.ROOT)) {
            case "SHA-1", "SHA1" -> SHA1;
            case "SHA-256", "SHA256" -> SHA256;
            default -> throw new IllegalArgumentException("unsupported hash algo: " + s);
        };
    }

    public String dirName() { return name().toLowerCase(Locale.ROOT); }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JCA provider lacks " + jcaName, e);
        }
    }

    /** Lower-cased hex of the given length, or an {@link IllegalArgumentException}. */
    public String requireHex(String field, String hex) {
        if (hex == null || hex.isBlank()) throw new IllegalArgumentException(field + " required");
        String s = hex.trim().toLowerCase(Locale.ROOT);
        if (s.length() != hexLen) throw new IllegalArgumentException(field + " length != " + hexLen);
        if (!s.matches("[0-9a-f]+")) throw new IllegalArgumentException(field + " not hex");
        return s;
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(Character.forDigit((b >>> 4) & 0xF, 16))
                .append(Character.forDigit(b & 0xF, 16));
        return sb.toString();
    }
}

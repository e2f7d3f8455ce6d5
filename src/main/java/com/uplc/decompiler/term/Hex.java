package com.uplc.decompiler.term;

/** Lowercase hex encoding for byte strings. */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String encode(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[i * 2] = DIGITS[v >>> 4];
            out[i * 2 + 1] = DIGITS[v & 0x0f];
        }
        return new String(out);
    }

    /** Decodes hex text, with or without a leading "0x" or "#". */
    public static byte[] decode(String s) {
        String hex = strip(s);
        if ((hex.length() & 1) != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + s);
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) throw new IllegalArgumentException("invalid hex string: " + s);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    public static boolean isHex(String s) {
        if (s == null) return false;
        String hex = strip(s);
        if ((hex.length() & 1) != 0) return false;
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    private static String strip(String s) {
        if (s.startsWith("0x") || s.startsWith("0X")) return s.substring(2);
        if (s.startsWith("#")) return s.substring(1);
        return s;
    }
}

package com.uplc.decompiler.convert;

/**
 * Fresh-name source for one conversion: a, b, ..., z, a1, b1, ..., z1, a2, ...
 * Not shared between conversions.
 */
public final class NameCounter {
    private int next;

    public String next() {
        return nameFor(next++);
    }

    public int issued() {
        return next;
    }

    public static String nameFor(int index) {
        char letter = (char) ('a' + index % 26);
        int round = index / 26;
        return round == 0 ? String.valueOf(letter) : letter + Integer.toString(round);
    }
}

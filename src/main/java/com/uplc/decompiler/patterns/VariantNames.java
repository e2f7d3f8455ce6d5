package com.uplc.decompiler.patterns;

import java.util.List;

/** Default enum constructor names, by constructor index. */
public final class VariantNames {

    private static final List<String> DEFAULTS = List.of("Cancel", "Update", "Claim", "Execute", "Withdraw", "Deposit");

    private VariantNames() {}

    public static String forIndex(int index) {
        return index < DEFAULTS.size() ? DEFAULTS.get(index) : "Variant" + index;
    }
}

package com.uplc.decompiler.patterns;

import java.util.List;

/** Positional fields of the V3 transaction info constructor. */
public final class TxFields {

    public static final int EXTRA_SIGNATORIES = 8;
    public static final int VOTES = 12;
    public static final int PROPOSAL_PROCEDURES = 13;

    private static final List<String> NAMES = List.of(
            "inputs", "reference_inputs", "outputs", "fee", "mint", "certificates",
            "withdrawals", "validity_range", "extra_signatories", "redeemers", "datums",
            "id", "votes", "proposal_procedures", "current_treasury_amount", "treasury_donation");

    private TxFields() {}

    /** Field name for {@code index}, or {@code field_<index>} past the known fields. */
    public static String name(int index) {
        return index >= 0 && index < NAMES.size() ? NAMES.get(index) : "field_" + index;
    }
}

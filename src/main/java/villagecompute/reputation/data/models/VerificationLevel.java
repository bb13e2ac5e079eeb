/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.data.models;

/**
 * Verification level of a user and its integer encoding on the ledger.
 *
 * <p>
 * The label-to-code mapping is total: unknown or missing labels map to {@link #BASIC} (code 0).
 */
public enum VerificationLevel {

    BASIC("basic", 0), VERIFIED("verified", 1), EXPERT("expert", 2);

    private final String label;
    private final int ledgerCode;

    VerificationLevel(String label, int ledgerCode) {
        this.label = label;
        this.ledgerCode = ledgerCode;
    }

    public String label() {
        return label;
    }

    public int ledgerCode() {
        return ledgerCode;
    }

    /**
     * Resolves a stored label, falling back to {@link #BASIC} for anything unrecognized.
     *
     * @param label
     *            stored verification label (case-insensitive, may be null)
     * @return matching level, never null
     */
    public static VerificationLevel fromLabel(String label) {
        if (label != null) {
            for (VerificationLevel level : values()) {
                if (level.label.equalsIgnoreCase(label.trim())) {
                    return level;
                }
            }
        }
        return BASIC;
    }
}

package com.flagship.bank_ledger.customer;

/**
 * Format checks for national IDs.
 */
public final class NationalIds {

    public static final int LENGTH = 11;

    private NationalIds() {
        // Utility class
    }

    /**
     * A valid national ID is exactly 11 ASCII digits, without punctuation.
     */
    public static boolean isValid(String nationalId) {
        if (nationalId == null || nationalId.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < nationalId.length(); i++) {
            char c = nationalId.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}

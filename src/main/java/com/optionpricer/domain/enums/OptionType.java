package com.optionpricer.domain.enums;

/**
 * European option right. Calls pay max(S - K, 0) at expiry, puts pay max(K - S, 0).
 */
public enum OptionType {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }
}

package com.apex.riskcore.model;

public record TradeCheckResult(boolean approved, String reason) {

    public static final String APPROVED = "approved";

    public static TradeCheckResult approve() {
        return new TradeCheckResult(true, APPROVED);
    }

    public static TradeCheckResult rejected(String reason) {
        return new TradeCheckResult(false, reason);
    }
}

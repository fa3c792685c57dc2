package com.apex.riskcore.model;

public enum HaltCause {
    DRAWDOWN,
    DAILY_LOSS,
    MANUAL
}

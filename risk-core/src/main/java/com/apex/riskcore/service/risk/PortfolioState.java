package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.HaltCause;
import com.apex.riskcore.model.OpenPosition;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable portfolio snapshot owned by a single {@link RiskManager}. Callers get read access only.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class PortfolioState {

    private double totalEquity;
    private double peakEquity;
    private double dailyStartEquity;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<String, OpenPosition> openPositions = new LinkedHashMap<>();
    private double dailyPnl;
    private double totalPnl;
    private boolean halted;
    private String haltReason = "";
    private HaltCause haltCause;
    private Instant lastUpdate;

    PortfolioState(double initialEquity) {
        this.totalEquity = initialEquity;
        this.peakEquity = initialEquity;
        this.dailyStartEquity = initialEquity;
    }

    public Map<String, OpenPosition> getOpenPositions() {
        return Collections.unmodifiableMap(openPositions);
    }

    public int getOpenPositionCount() {
        return openPositions.size();
    }

    /**
     * {@code 1 - equity / peak}, or 0 when the peak is not positive.
     */
    public double getDrawdown() {
        return peakEquity > 0 ? 1.0 - totalEquity / peakEquity : 0.0;
    }

    Map<String, OpenPosition> positions() {
        return openPositions;
    }

    void clearHalt() {
        halted = false;
        haltReason = "";
        haltCause = null;
    }

    void halt(HaltCause cause, String reason) {
        halted = true;
        haltCause = cause;
        haltReason = reason;
    }
}

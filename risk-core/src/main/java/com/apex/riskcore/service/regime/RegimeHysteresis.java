package com.apex.riskcore.service.regime;

import com.apex.riskcore.model.Regime;
import com.apex.riskcore.service.regime.RegimeScorer.Classification;

/**
 * Sequential fold over per-bar classifications. A new regime replaces the held one only after
 * {@code bars} consecutive bars agree on it; meanwhile the held regime is emitted.
 */
class RegimeHysteresis {

    private final int bars;

    private Regime held;
    private double heldConfidence;
    private Regime pending;
    private int pendingCount;
    private boolean afterWarmup = true;

    RegimeHysteresis(int bars) {
        this.bars = bars;
    }

    /**
     * @param raw classification of the current bar, or null for a warmup bar
     */
    Classification next(Classification raw) {
        if (raw == null || raw.regime() == Regime.UNKNOWN) {
            afterWarmup = true;
            return Classification.UNKNOWN;
        }
        if (held == null || afterWarmup) {
            afterWarmup = false;
            return accept(raw);
        }
        if (raw.regime() == held) {
            pending = null;
            pendingCount = 0;
            heldConfidence = raw.confidence();
            return raw;
        }
        if (raw.regime() == pending) {
            pendingCount++;
        } else {
            pending = raw.regime();
            pendingCount = 1;
        }
        if (pendingCount >= bars) {
            return accept(raw);
        }
        return new Classification(held, heldConfidence);
    }

    private Classification accept(Classification raw) {
        held = raw.regime();
        heldConfidence = raw.confidence();
        pending = null;
        pendingCount = 0;
        return raw;
    }
}

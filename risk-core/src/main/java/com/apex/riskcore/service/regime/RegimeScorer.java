package com.apex.riskcore.service.regime;

import com.apex.riskcore.model.Regime;
import com.apex.riskcore.model.RegimeConfig;
import lombok.RequiredArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

import static com.apex.riskcore.util.MathUtils.clamp;

/**
 * Composite scoring of the six named regimes from the five sub-indicators. Every score lies in
 * [0, 1]; {@link Regime#UNKNOWN} always scores 0.
 */
@RequiredArgsConstructor
public class RegimeScorer {

    static final double SLOPE_SCALE = 0.01;
    static final double ADX_EXCESS_SCALE = 20.0;
    static final double ADX_BAND_FALLOFF = 10.0;

    static final double MIN_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 1.0;

    private final RegimeConfig config;

    public record Classification(Regime regime, double confidence) {

        static final Classification UNKNOWN = new Classification(Regime.UNKNOWN, 0.0);
    }

    public Map<Regime, Double> score(double adx, double bbPct, double slope, double alignment, double structure) {
        double strong = config.getAdxStrong();
        double weak = config.getAdxWeak();
        double highVol = config.getBbHighVolPct();

        double adxStrength = clamp((adx - weak) / (strong - weak), 0, 1);
        double adxExcess = clamp((adx - strong) / ADX_EXCESS_SCALE, 0, 1);
        double lowAdx = clamp(1 - adx / strong, 0, 1);
        double inBand = weak <= adx && adx <= strong ? 1.0
                : clamp(1 - (adx < weak ? weak - adx : adx - strong) / ADX_BAND_FALLOFF, 0, 1);
        double slopeScore = clamp(slope / SLOPE_SCALE, -1, 1);
        double volatility = clamp((bbPct - 50) / (highVol - 50), 0, 1);
        double volatilityExcess = clamp((bbPct - highVol) / (100 - highVol), 0, 1);

        Map<Regime, Double> scores = new EnumMap<>(Regime.class);
        scores.put(Regime.STRONG_TREND_UP, strongTrend(1, adx, adxStrength, adxExcess, slope, slopeScore, alignment, structure));
        scores.put(Regime.WEAK_TREND_UP, weakTrend(1, adx, inBand, slope, slopeScore, alignment, structure));
        scores.put(Regime.RANGING, ranging(lowAdx, slopeScore, alignment, volatility));
        scores.put(Regime.WEAK_TREND_DOWN, weakTrend(-1, adx, inBand, slope, slopeScore, alignment, structure));
        scores.put(Regime.STRONG_TREND_DOWN, strongTrend(-1, adx, adxStrength, adxExcess, slope, slopeScore, alignment, structure));
        scores.put(Regime.HIGH_VOLATILITY, highVolatility(adx, bbPct, lowAdx, volatility, volatilityExcess));
        scores.put(Regime.UNKNOWN, 0.0);
        return scores;
    }

    /**
     * Winner is the highest score (earlier enum constant on ties). Confidence grows with both the
     * winning score and its margin over the runner-up.
     */
    public Classification classify(double adx, double bbPct, double slope, double alignment, double structure) {
        Map<Regime, Double> scores = score(adx, bbPct, slope, alignment, structure);
        Regime best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        double secondScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Regime, Double> entry : scores.entrySet()) {
            if (entry.getKey() == Regime.UNKNOWN) {
                continue;
            }
            double value = entry.getValue();
            if (value > bestScore) {
                secondScore = bestScore;
                bestScore = value;
                best = entry.getKey();
            } else if (value > secondScore) {
                secondScore = value;
            }
        }
        double confidence = clamp(0.6 * bestScore + 2.0 * (bestScore - secondScore) + 0.2, MIN_CONFIDENCE, MAX_CONFIDENCE);
        return new Classification(best, confidence);
    }

    private double strongTrend(int direction, double adx, double adxStrength, double adxExcess, double slope,
                               double slopeScore, double alignment, double structure) {
        double score = 0.30 * adxStrength
                + 0.15 * adxExcess
                + 0.25 * Math.max(direction * alignment, 0)
                + 0.15 * Math.max(direction * slopeScore, 0)
                + 0.15 * Math.max(direction * structure, 0);
        if (adx > config.getAdxStrong()
                && direction * alignment > config.getStrongAlignmentThreshold()
                && direction * slope > 0
                && direction * structure > config.getStrongStructureThreshold()) {
            score += 0.10;
        }
        return clamp(score, 0, 1);
    }

    private double weakTrend(int direction, double adx, double inBand, double slope, double slopeScore,
                             double alignment, double structure) {
        double score = 0.30 * inBand
                + 0.25 * Math.max(direction * alignment, 0)
                + 0.20 * Math.max(direction * slopeScore, 0)
                + 0.10 * Math.max(direction * structure, 0);
        if (config.getAdxWeak() <= adx && adx <= config.getAdxStrong()
                && direction * alignment > 0
                && direction * slope > 0) {
            score += 0.05;
        }
        return clamp(score, 0, 1);
    }

    private double highVolatility(double adx, double bbPct, double lowAdx, double volatility, double volatilityExcess) {
        double score = 0.45 * volatility + 0.30 * lowAdx + 0.15 * volatilityExcess;
        if (bbPct > config.getBbHighVolPct() && adx < config.getAdxWeak()) {
            score += 0.10;
        }
        return clamp(score, 0, 1);
    }

    // directional signal pulls the range score down
    private double ranging(double lowAdx, double slopeScore, double alignment, double volatility) {
        double score = 0.40 * lowAdx
                + 0.15 * (1 - Math.abs(slopeScore))
                + 0.15 * (1 - Math.abs(alignment))
                + 0.10 * (1 - volatility);
        double directionPenalty = 1 - 0.5 * Math.max(Math.abs(alignment), Math.abs(slopeScore));
        return clamp(score * directionPenalty, 0, 1);
    }
}

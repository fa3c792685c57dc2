package com.apex.riskcore.service.regime;

import com.apex.riskcore.exception.RiskCoreException;
import com.apex.riskcore.model.Candle;
import com.apex.riskcore.model.Regime;
import com.apex.riskcore.model.RegimeBar;
import com.apex.riskcore.model.RegimeConfig;
import com.apex.riskcore.model.RegimeState;
import com.apex.riskcore.service.indicator.AdxService;
import com.apex.riskcore.service.indicator.BollingerBandService;
import com.apex.riskcore.service.indicator.EmaService;
import com.apex.riskcore.service.indicator.PriceStructureService;
import com.apex.riskcore.service.regime.RegimeScorer.Classification;
import com.apex.riskcore.util.MathUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.apex.riskcore.util.MathUtils.nanToZero;

/**
 * Classifies market conditions from OHLCV history using ADX, Bollinger-width percentile, EMA
 * slope, multi-EMA alignment and price structure.
 */
@Slf4j
public class RegimeDetector {

    @Getter
    private final RegimeConfig config;
    private final RegimeScorer scorer;
    private final AdxService adxService;
    private final BollingerBandService bollingerBandService;
    private final EmaService emaService;
    private final PriceStructureService priceStructureService;

    public RegimeDetector() {
        this(RegimeConfig.defaults());
    }

    public RegimeDetector(RegimeConfig config) {
        validate(config);
        this.config = config;
        this.scorer = new RegimeScorer(config);
        this.adxService = new AdxService(config.getAdxPeriod());
        this.bollingerBandService = new BollingerBandService(config.getBbPeriod(), config.getBbStd());
        this.emaService = new EmaService();
        this.priceStructureService = new PriceStructureService(config.getStructureLookback());
    }

    /**
     * Per-bar sub-indicator columns. ADX and band percentile are {@code NaN} while warming up.
     */
    public record Indicators(double[] adx, double[] bbWidthPercentile, double[] emaSlope,
                             double[] trendAlignment, double[] priceStructure) {

        public int size() {
            return adx.length;
        }

        public boolean isWarmup(int bar) {
            return Double.isNaN(adx[bar]) || Double.isNaN(bbWidthPercentile[bar]);
        }
    }

    public Indicators computeIndicators(List<Candle> candles) {
        requireCandles(candles);
        double[] closes = candles.stream().mapToDouble(Candle::getClose).toArray();
        return new Indicators(
                adxService.calculate(candles),
                bollingerBandService.widthPercentile(closes),
                emaService.slope(closes, config.getEmaSlopePeriod(), config.getEmaSlopeLookback()),
                emaService.alignment(closes, config.getAlignmentEmaPeriods()),
                priceStructureService.calculate(closes));
    }

    public Map<Regime, Double> scores(double adx, double bbPct, double slope, double alignment, double structure) {
        return scorer.score(adx, bbPct, slope, alignment, structure);
    }

    public Classification classify(double adx, double bbPct, double slope, double alignment, double structure) {
        return scorer.classify(adx, bbPct, slope, alignment, structure);
    }

    /**
     * Regime of the latest bar, without hysteresis, plus transition probabilities estimated from
     * the per-bar classification of the same history.
     */
    public RegimeState detect(List<Candle> candles) {
        Indicators indicators = computeIndicators(candles);
        if (indicators.size() == 0) {
            return new RegimeState(Regime.UNKNOWN, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        List<Classification> raw = classifyBars(indicators);
        int last = indicators.size() - 1;
        Classification current = raw.get(last);
        Map<String, Double> transitions = transitionProbabilities(raw);
        log.debug("Detected {} (confidence {}) over {} bars", current.regime(), current.confidence(), indicators.size());

        return new RegimeState(
                current.regime(),
                current.confidence(),
                nanToZero(indicators.adx()[last]),
                nanToZero(indicators.bbWidthPercentile()[last]),
                nanToZero(indicators.emaSlope()[last]),
                nanToZero(indicators.trendAlignment()[last]),
                nanToZero(indicators.priceStructure()[last]),
                transitions);
    }

    /**
     * One row per candle, smoothed by hysteresis. Warmup rows are {@link Regime#UNKNOWN} with zero
     * confidence.
     */
    public List<RegimeBar> detectSeries(List<Candle> candles) {
        Indicators indicators = computeIndicators(candles);
        List<Classification> raw = classifyBars(indicators);
        RegimeHysteresis hysteresis = new RegimeHysteresis(config.getHysteresisBars());

        List<RegimeBar> bars = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Classification smoothed = hysteresis.next(raw.get(i));
            bars.add(new RegimeBar(
                    candles.get(i).getTimestamp(),
                    smoothed.regime(),
                    smoothed.confidence(),
                    indicators.adx()[i],
                    indicators.bbWidthPercentile()[i],
                    indicators.emaSlope()[i],
                    indicators.trendAlignment()[i],
                    indicators.priceStructure()[i]));
        }
        return bars;
    }

    private List<Classification> classifyBars(Indicators indicators) {
        List<Classification> raw = new ArrayList<>(indicators.size());
        for (int i = 0; i < indicators.size(); i++) {
            if (indicators.isWarmup(i)) {
                raw.add(Classification.UNKNOWN);
                continue;
            }
            raw.add(scorer.classify(
                    indicators.adx()[i],
                    indicators.bbWidthPercentile()[i],
                    nanToZero(indicators.emaSlope()[i]),
                    nanToZero(indicators.trendAlignment()[i]),
                    nanToZero(indicators.priceStructure()[i])));
        }
        return raw;
    }

    /**
     * Empirical next-regime frequencies from the current regime over the last
     * {@code transitionLookback} classified bars. Warmup bars are skipped.
     */
    Map<String, Double> transitionProbabilities(List<Classification> raw) {
        List<Regime> classified = raw.stream()
                .map(Classification::regime)
                .filter(regime -> regime != Regime.UNKNOWN)
                .toList();
        int from = Math.max(0, classified.size() - config.getTransitionLookback());
        List<Regime> recent = classified.subList(from, classified.size());
        if (recent.size() < 2) {
            return Map.of();
        }

        Regime current = recent.get(recent.size() - 1);
        Map<String, Integer> counts = new LinkedHashMap<>();
        int total = 0;
        for (int i = 0; i < recent.size() - 1; i++) {
            if (recent.get(i) == current) {
                counts.merge(recent.get(i + 1).value(), 1, Integer::sum);
                total++;
            }
        }
        if (total == 0) {
            return Map.of();
        }

        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            probabilities.put(entry.getKey(), MathUtils.round((double) entry.getValue() / total, 3));
        }
        return probabilities;
    }

    private static void requireCandles(List<Candle> candles) {
        if (candles == null) {
            throw new RiskCoreException("Candle history is required for regime detection");
        }
    }

    private static void validate(RegimeConfig config) {
        if (config == null) {
            throw new RiskCoreException("Regime config is required");
        }
        if (config.getAdxStrong() <= config.getAdxWeak()) {
            throw new RiskCoreException("adxStrong must be greater than adxWeak");
        }
        if (config.getBbHighVolPct() <= 50 || config.getBbHighVolPct() >= 100) {
            throw new RiskCoreException("bbHighVolPct must be between 50 and 100");
        }
        if (config.getHysteresisBars() < 1) {
            throw new RiskCoreException("hysteresisBars must be at least 1");
        }
        if (config.getAlignmentEmaPeriods() == null || config.getAlignmentEmaPeriods().isEmpty()) {
            throw new RiskCoreException("At least one alignment EMA period is required");
        }
        if (config.getAdxPeriod() < 1 || config.getBbPeriod() < 2 || config.getEmaSlopePeriod() < 1
                || config.getEmaSlopeLookback() < 1 || config.getStructureLookback() < 1
                || config.getTransitionLookback() < 2) {
            throw new RiskCoreException("Indicator periods must be positive");
        }
    }
}

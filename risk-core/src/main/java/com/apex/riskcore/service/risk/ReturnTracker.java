package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.CorrelationMatrix;
import com.apex.riskcore.model.VaRResult;
import com.apex.riskcore.model.VarMethod;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolling per-symbol price and simple-return history used for correlation and VaR estimates.
 *
 * <p>Not thread-safe; one tracker belongs to one portfolio.
 */
@Slf4j
public class ReturnTracker {

    public static final int DEFAULT_MAX_HISTORY = 252;
    static final int MIN_OBSERVATIONS = 20;

    @Getter
    private final int maxHistory;
    private final Map<String, Deque<Double>> prices = new LinkedHashMap<>();
    private final Map<String, Deque<Double>> returns = new LinkedHashMap<>();
    private final CorrelationService correlationService;
    private final VarCalculator varCalculator;

    public ReturnTracker() {
        this(DEFAULT_MAX_HISTORY);
    }

    public ReturnTracker(int maxHistory) {
        this(maxHistory, new CorrelationService(), new VarCalculator());
    }

    public ReturnTracker(int maxHistory, CorrelationService correlationService, VarCalculator varCalculator) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.maxHistory = maxHistory;
        this.correlationService = correlationService;
        this.varCalculator = varCalculator;
    }

    public void recordPrice(String symbol, double price) {
        Deque<Double> symbolPrices = prices.computeIfAbsent(symbol, s -> new ArrayDeque<>(maxHistory + 1));
        Deque<Double> symbolReturns = returns.computeIfAbsent(symbol, s -> new ArrayDeque<>(maxHistory));

        Double previous = symbolPrices.peekLast();
        append(symbolPrices, price, maxHistory + 1);
        if (previous == null) {
            return;
        }
        if (previous == 0) {
            log.warn("Skipping return for {}: previous price is zero", symbol);
            return;
        }
        append(symbolReturns, (price - previous) / previous, maxHistory);
    }

    public double[] getReturns(String symbol) {
        Deque<Double> series = returns.get(symbol);
        if (series == null) {
            return new double[0];
        }
        return toArray(series, series.size());
    }

    /**
     * Symbols with a return buffer, in first-seen order.
     */
    public List<String> getTrackedSymbols() {
        return List.copyOf(returns.keySet());
    }

    public CorrelationMatrix getCorrelationMatrix() {
        return getCorrelationMatrix(returns.keySet());
    }

    /**
     * Correlation of the given symbols' returns, restricted to symbols with at least 20 observations
     * and aligned to their shortest common, most recent window. Empty when fewer than two qualify.
     */
    public CorrelationMatrix getCorrelationMatrix(Collection<String> symbols) {
        Map<String, double[]> aligned = alignedReturns(symbols);
        if (aligned.size() < 2) {
            return CorrelationMatrix.empty();
        }
        return correlationService.buildCorrelationMatrix(aligned);
    }

    /**
     * Portfolio VaR/CVaR from the weighted sum of aligned per-symbol returns.
     *
     * @param symbolWeights  symbol to position value / portfolio value
     * @param portfolioValue currency value the loss figures are scaled to
     */
    public VaRResult computeVar(Map<String, Double> symbolWeights, double portfolioValue, VarMethod method) {
        Map<String, double[]> aligned = alignedReturns(symbolWeights.keySet());
        if (aligned.isEmpty()) {
            return VaRResult.empty(method);
        }
        int length = aligned.values().iterator().next().length;
        double[] portfolioReturns = new double[length];
        for (Map.Entry<String, double[]> entry : aligned.entrySet()) {
            double weight = symbolWeights.getOrDefault(entry.getKey(), 0.0);
            double[] series = entry.getValue();
            for (int t = 0; t < length; t++) {
                portfolioReturns[t] += series[t] * weight;
            }
        }
        return varCalculator.calculate(portfolioReturns, portfolioValue, method);
    }

    private Map<String, double[]> alignedReturns(Collection<String> symbols) {
        List<String> eligible = new ArrayList<>();
        for (String symbol : symbols) {
            Deque<Double> series = returns.get(symbol);
            if (series != null && series.size() >= MIN_OBSERVATIONS && !eligible.contains(symbol)) {
                eligible.add(symbol);
            }
        }
        Map<String, double[]> aligned = new LinkedHashMap<>();
        if (eligible.isEmpty()) {
            return aligned;
        }
        int length = eligible.stream().mapToInt(s -> returns.get(s).size()).min().orElse(0);
        for (String symbol : eligible) {
            aligned.put(symbol, toArray(returns.get(symbol), length));
        }
        return aligned;
    }

    private static void append(Deque<Double> buffer, double value, int capacity) {
        buffer.addLast(value);
        while (buffer.size() > capacity) {
            buffer.removeFirst();
        }
    }

    // most recent length values, oldest first
    private static double[] toArray(Deque<Double> series, int length) {
        double[] out = new double[length];
        Iterator<Double> it = series.descendingIterator();
        for (int i = length - 1; i >= 0; i--) {
            out[i] = it.next();
        }
        return out;
    }
}

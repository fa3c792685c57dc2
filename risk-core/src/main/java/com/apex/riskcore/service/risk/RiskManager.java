package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.CorrelationMatrix;
import com.apex.riskcore.model.CorrelationPair;
import com.apex.riskcore.model.HaltCause;
import com.apex.riskcore.model.HeatCheckReport;
import com.apex.riskcore.model.OpenPosition;
import com.apex.riskcore.model.RiskLimits;
import com.apex.riskcore.model.RiskStatus;
import com.apex.riskcore.model.TradeCheckRecord;
import com.apex.riskcore.model.TradeCheckResult;
import com.apex.riskcore.model.TradeSide;
import com.apex.riskcore.model.VaRResult;
import com.apex.riskcore.model.VarMethod;
import com.apex.riskcore.util.MathUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gates every trade decision for one portfolio: drawdown and daily-loss halts, position sizing,
 * concentration, stop distance and correlation checks.
 *
 * <p>Instances are owned by the caller and are not thread-safe.
 */
@Slf4j
public class RiskManager {

    public static final double DEFAULT_INITIAL_EQUITY = 10_000.0;
    public static final int DEFAULT_TRADE_LOG_CAPACITY = 500;

    static final double DRAWDOWN_WARNING_RATIO = 0.8;
    static final double CONCENTRATION_WARNING_RATIO = 0.9;
    static final double VAR_WARNING_EQUITY_PCT = 0.10;

    @Getter
    private final RiskLimits limits;
    @Getter
    private final ReturnTracker returnTracker;
    @Getter
    private final PortfolioState state;
    private final CorrelationService correlationService;
    private final Deque<TradeCheckRecord> tradeCheckLog;
    private final int tradeLogCapacity;
    private final Clock clock;

    public RiskManager() {
        this(RiskLimits.defaults());
    }

    public RiskManager(RiskLimits limits) {
        this(limits, new ReturnTracker(), DEFAULT_INITIAL_EQUITY, DEFAULT_TRADE_LOG_CAPACITY, Clock.systemUTC());
    }

    public RiskManager(RiskLimits limits, ReturnTracker returnTracker, double initialEquity,
                       int tradeLogCapacity, Clock clock) {
        this.limits = limits != null ? limits : RiskLimits.defaults();
        this.returnTracker = returnTracker;
        this.state = new PortfolioState(initialEquity);
        this.correlationService = new CorrelationService();
        this.tradeLogCapacity = Math.max(1, tradeLogCapacity);
        this.tradeCheckLog = new ArrayDeque<>(this.tradeLogCapacity);
        this.clock = clock;
        log.info("RiskManager initialized: {}", this.limits);
    }

    /**
     * Records the latest equity and applies the drawdown and daily-loss limits.
     *
     * @return false when a limit is breached and trading has been halted
     */
    public boolean updateEquity(double currentEquity) {
        state.setTotalEquity(currentEquity);
        state.setPeakEquity(Math.max(state.getPeakEquity(), currentEquity));
        state.setLastUpdate(clock.instant());

        double drawdown = state.getDrawdown();
        if (drawdown >= limits.getMaxPortfolioDrawdown()) {
            String reason = "Max drawdown breached: " + MathUtils.percent(drawdown)
                    + " >= " + MathUtils.percent(limits.getMaxPortfolioDrawdown());
            state.halt(HaltCause.DRAWDOWN, reason);
            log.error("🛑 {}", reason);
            return false;
        }

        double dailyStart = state.getDailyStartEquity();
        double dailyChange = dailyStart > 0 ? (currentEquity - dailyStart) / dailyStart : 0.0;
        if (dailyChange <= -limits.getMaxDailyLoss()) {
            String reason = "Daily loss limit breached: " + MathUtils.percent(dailyChange)
                    + " <= -" + MathUtils.percent(limits.getMaxDailyLoss());
            // a drawdown or manual halt keeps its own cause
            if (!state.isHalted() || state.getHaltCause() == HaltCause.DAILY_LOSS) {
                state.halt(HaltCause.DAILY_LOSS, reason);
            }
            log.error("🛑 {}", reason);
            return false;
        }

        return true;
    }

    /**
     * Starts a new trading day. Only a daily-loss halt is lifted here.
     */
    public void resetDaily() {
        state.setDailyStartEquity(state.getTotalEquity());
        state.setDailyPnl(0.0);
        if (state.isHalted() && state.getHaltCause() == HaltCause.DAILY_LOSS) {
            state.clearHalt();
            log.info("Daily halt cleared, trading resumed");
        }
    }

    public void halt(String reason) {
        state.halt(HaltCause.MANUAL, reason == null || reason.isBlank() ? "Manual halt" : reason);
        log.error("🛑 Trading halted manually: {}", state.getHaltReason());
    }

    public void resume() {
        if (!state.isHalted()) {
            return;
        }
        log.warn("Trading resumed (was halted: {})", state.getHaltReason());
        state.clearHalt();
    }

    public boolean isHalted() {
        return state.isHalted();
    }

    public double calculatePositionSize(double entryPrice, double stopLossPrice) {
        return calculatePositionSize(entryPrice, stopLossPrice, null, null);
    }

    public double calculatePositionSize(double entryPrice, double stopLossPrice, Double riskPerTrade) {
        return calculatePositionSize(entryPrice, stopLossPrice, riskPerTrade, null);
    }

    /**
     * Fixed-fractional sizing: {@code equity * risk / |entry - stop|}, capped at
     * {@code maxPositionSizePct} of equity and then scaled by the regime modifier.
     *
     * @param riskPerTrade   fraction of equity to risk, null or 0 falls back to {@code maxSingleTradeRisk}
     * @param regimeModifier multiplier from strategy routing, null means 1.0
     * @return size in base units, 0 when stop equals entry or entry is not positive
     */
    public double calculatePositionSize(double entryPrice, double stopLossPrice, Double riskPerTrade,
                                        Double regimeModifier) {
        double riskPct = riskPerTrade == null || riskPerTrade == 0 ? limits.getMaxSingleTradeRisk() : riskPerTrade;
        double equity = state.getTotalEquity();
        double riskAmount = equity * riskPct;
        double priceRisk = Math.abs(entryPrice - stopLossPrice);

        if (priceRisk == 0) {
            log.warn("Stop loss equals entry price, returning 0 size");
            return 0.0;
        }
        if (entryPrice <= 0) {
            log.warn("Entry price {} is not positive, returning 0 size", entryPrice);
            return 0.0;
        }

        double size = riskAmount / priceRisk;
        double maxSize = equity * limits.getMaxPositionSizePct() / entryPrice;
        size = Math.min(size, maxSize);

        double modifier = regimeModifier == null ? 1.0 : regimeModifier;
        size *= modifier;

        log.info("Position size: {} (risk ${}, price risk ${}, entry ${}, regime x{})",
                String.format(Locale.ROOT, "%.6f", size),
                String.format(Locale.ROOT, "%.2f", riskAmount),
                String.format(Locale.ROOT, "%.2f", priceRisk),
                String.format(Locale.ROOT, "%.2f", entryPrice),
                modifier);
        return size;
    }

    public TradeCheckResult checkNewTrade(String symbol, TradeSide side, double size, double entryPrice) {
        return checkNewTrade(symbol, side, size, entryPrice, null);
    }

    /**
     * Runs the trade gate in a fixed order and returns the first rejection, or approval. Every call
     * is appended to the trade-check log.
     */
    public TradeCheckResult checkNewTrade(String symbol, TradeSide side, double size, double entryPrice,
                                          Double stopLossPrice) {
        TradeCheckResult result = evaluate(symbol, size, entryPrice, stopLossPrice);
        if (result.approved()) {
            log.info("Trade approved: {} {} {} @ {}", side, String.format(Locale.ROOT, "%.6f", size), symbol, entryPrice);
        } else {
            log.info("Trade rejected: {} {} - {}", side, symbol, result.reason());
        }
        appendCheckRecord(new TradeCheckRecord(
                symbol,
                side,
                size,
                entryPrice,
                stopLossPrice,
                result.approved(),
                result.reason(),
                state.getTotalEquity(),
                state.getDrawdown(),
                state.getOpenPositionCount(),
                clock.instant()));
        return result;
    }

    private TradeCheckResult evaluate(String symbol, double size, double entryPrice, Double stopLossPrice) {
        // Gate 1: Halt
        if (state.isHalted()) {
            return TradeCheckResult.rejected("Trading halted: " + state.getHaltReason());
        }

        // Gate 2: Max positions
        if (state.getOpenPositionCount() >= limits.getMaxOpenPositions()) {
            return TradeCheckResult.rejected("Max open positions reached (" + limits.getMaxOpenPositions() + ")");
        }

        // Gate 3: Duplicate
        if (state.positions().containsKey(symbol)) {
            return TradeCheckResult.rejected("Already have open position in " + symbol);
        }

        // Gate 4: Position size vs equity
        double equity = state.getTotalEquity();
        if (equity <= 0) {
            return TradeCheckResult.rejected("Position too large: portfolio equity is not positive");
        }
        double positionPct = size * entryPrice / equity;
        if (positionPct > limits.getMaxPositionSizePct()) {
            return TradeCheckResult.rejected("Position too large: " + MathUtils.percent(positionPct)
                    + " > " + MathUtils.percent(limits.getMaxPositionSizePct()));
        }

        // Gate 5: Stop distance
        if (stopLossPrice != null && stopLossPrice > 0 && entryPrice > 0) {
            double tradeRisk = Math.abs(entryPrice - stopLossPrice) / entryPrice;
            if (tradeRisk > limits.getMaxSingleTradeRisk() * 2) {
                return TradeCheckResult.rejected("Stop loss too wide: " + MathUtils.percent(tradeRisk) + " risk per unit");
            }
        }

        // Gate 6: Correlation
        return checkCorrelation(symbol);
    }

    private TradeCheckResult checkCorrelation(String symbol) {
        if (state.positions().isEmpty()) {
            return TradeCheckResult.approve();
        }

        List<String> existing = new ArrayList<>(state.positions().keySet());
        List<String> candidates = new ArrayList<>(existing);
        candidates.add(symbol);

        CorrelationMatrix matrix = returnTracker.getCorrelationMatrix(candidates);
        if (matrix.isEmpty()) {
            log.info("Insufficient return history for correlation check on {}", symbol);
            return TradeCheckResult.approve();
        }
        if (!matrix.contains(symbol)) {
            return TradeCheckResult.approve();
        }

        for (String other : existing) {
            if (!matrix.contains(other)) {
                continue;
            }
            double correlation = Math.abs(matrix.get(symbol, other));
            if (correlation > limits.getMaxCorrelation()) {
                return TradeCheckResult.rejected("Correlation too high: " + symbol + " vs " + other + " = "
                        + String.format(Locale.ROOT, "%.2f", correlation) + " > " + limits.getMaxCorrelation());
            }
        }
        return TradeCheckResult.approve();
    }

    public void registerTrade(String symbol, TradeSide side, double size, double entryPrice) {
        state.positions().put(symbol, new OpenPosition(side, size, entryPrice, clock.instant(), size * entryPrice));
        log.info("Registered {} {} {} @ {}", side, size, symbol, entryPrice);
    }

    /**
     * Removes the position and books its realized PnL into the daily and total figures.
     *
     * @return realized PnL, 0 when no position is open for the symbol
     */
    public double closeTrade(String symbol, double exitPrice) {
        OpenPosition position = state.positions().remove(symbol);
        if (position == null) {
            log.warn("No open position found for {}", symbol);
            return 0.0;
        }

        double pnl = position.side() == TradeSide.BUY
                ? (exitPrice - position.entryPrice()) * position.size()
                : (position.entryPrice() - exitPrice) * position.size();

        state.setDailyPnl(state.getDailyPnl() + pnl);
        state.setTotalPnl(state.getTotalPnl() + pnl);
        log.info("Closed {}: PnL ${} (daily: ${})", symbol,
                String.format(Locale.ROOT, "%.2f", pnl),
                String.format(Locale.ROOT, "%.2f", state.getDailyPnl()));
        return pnl;
    }

    public RiskStatus getStatus() {
        return new RiskStatus(
                state.getTotalEquity(),
                state.getPeakEquity(),
                state.getDrawdown(),
                state.getDailyPnl(),
                state.getTotalPnl(),
                state.getOpenPositionCount(),
                state.isHalted(),
                state.getHaltReason());
    }

    public VaRResult getVar() {
        return getVar(VarMethod.PARAMETRIC);
    }

    /**
     * Portfolio VaR for the current open positions, weighted by position value over equity.
     */
    public VaRResult getVar(VarMethod method) {
        double equity = state.getTotalEquity();
        if (state.positions().isEmpty() || equity <= 0) {
            return VaRResult.empty(method);
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        state.positions().forEach((symbol, position) -> weights.put(symbol, position.value() / equity));
        return returnTracker.computeVar(weights, equity, method);
    }

    public HeatCheckReport portfolioHeatCheck() {
        double equity = state.getTotalEquity();
        double drawdown = state.getDrawdown();

        CorrelationMatrix matrix = returnTracker.getCorrelationMatrix(state.positions().keySet());
        double maxCorrelation = correlationService.maxAbsoluteCorrelation(matrix);
        List<CorrelationPair> highCorrPairs = correlationService.highlyCorrelatedPairs(matrix, limits.getMaxCorrelation());

        VaRResult var = getVar();

        Map<String, Double> weights = new LinkedHashMap<>();
        state.positions().forEach((symbol, position) -> weights.put(symbol, equity > 0 ? position.value() / equity : 0.0));
        double maxConcentration = weights.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        List<String> issues = new ArrayList<>();
        if (state.isHalted()) {
            issues.add("HALTED: " + state.getHaltReason());
        }
        if (drawdown > limits.getMaxPortfolioDrawdown() * DRAWDOWN_WARNING_RATIO) {
            issues.add("Drawdown warning: " + MathUtils.percent(drawdown)
                    + " approaching limit " + MathUtils.percent(limits.getMaxPortfolioDrawdown()));
        }
        if (!highCorrPairs.isEmpty()) {
            issues.add("High correlation: " + highCorrPairs.stream()
                    .map(p -> p.first() + " vs " + p.second() + " = " + p.correlation())
                    .collect(Collectors.joining(", ")));
        }
        if (maxConcentration > limits.getMaxPositionSizePct() * CONCENTRATION_WARNING_RATIO) {
            issues.add("Concentration warning: " + MathUtils.percent(maxConcentration) + " in single position");
        }
        if (var.var99() > equity * VAR_WARNING_EQUITY_PCT) {
            issues.add("VaR warning: 99% VaR $" + String.format(Locale.ROOT, "%.0f", var.var99()) + " > 10% of equity");
        }

        Map<String, Double> roundedWeights = new LinkedHashMap<>();
        weights.forEach((symbol, weight) -> roundedWeights.put(symbol, MathUtils.round(weight, 4)));

        return new HeatCheckReport(
                issues.isEmpty(),
                issues,
                MathUtils.round(drawdown, 4),
                state.getDailyPnl(),
                state.getOpenPositionCount(),
                MathUtils.round(maxCorrelation, 3),
                highCorrPairs,
                MathUtils.round(maxConcentration, 4),
                roundedWeights,
                var.var95(),
                var.var99(),
                var.cvar95(),
                var.cvar99(),
                state.isHalted());
    }

    /**
     * Most recent trade-check records, newest first.
     */
    public List<TradeCheckRecord> getTradeCheckLog(int limit) {
        List<TradeCheckRecord> records = new ArrayList<>();
        Iterator<TradeCheckRecord> it = tradeCheckLog.descendingIterator();
        while (it.hasNext() && records.size() < limit) {
            records.add(it.next());
        }
        return records;
    }

    private void appendCheckRecord(TradeCheckRecord record) {
        tradeCheckLog.addLast(record);
        while (tradeCheckLog.size() > tradeLogCapacity) {
            tradeCheckLog.removeFirst();
        }
    }
}

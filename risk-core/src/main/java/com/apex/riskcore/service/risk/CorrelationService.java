package com.apex.riskcore.service.risk;

import com.apex.riskcore.model.CorrelationMatrix;
import com.apex.riskcore.model.CorrelationPair;
import com.apex.riskcore.util.MathUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class CorrelationService {

    /**
     * Builds the Pearson correlation matrix for equally long return series. A series with zero
     * variance correlates as {@code NaN} with everything but itself.
     *
     * @param alignedReturns symbol to return series, iteration order becomes matrix order
     */
    public CorrelationMatrix buildCorrelationMatrix(Map<String, double[]> alignedReturns) {
        if (alignedReturns.size() < 2) {
            return CorrelationMatrix.empty();
        }
        List<String> symbols = new ArrayList<>(alignedReturns.keySet());
        int observations = alignedReturns.get(symbols.get(0)).length;
        double[][] data = new double[observations][symbols.size()];
        for (int column = 0; column < symbols.size(); column++) {
            double[] series = alignedReturns.get(symbols.get(column));
            if (series.length != observations) {
                throw new IllegalArgumentException("Return series must be aligned to the same length");
            }
            for (int row = 0; row < observations; row++) {
                data[row][column] = series[row];
            }
        }
        RealMatrix correlations = new PearsonsCorrelation().computeCorrelationMatrix(data);
        return new CorrelationMatrix(symbols, correlations.getData());
    }

    /**
     * Absolute pairwise correlations of the upper triangle above {@code threshold}, rounded to three
     * decimals. {@code NaN} pairs are ignored.
     */
    public List<CorrelationPair> highlyCorrelatedPairs(CorrelationMatrix matrix, double threshold) {
        List<CorrelationPair> pairs = new ArrayList<>();
        List<String> symbols = matrix.getSymbols();
        for (int i = 0; i < symbols.size(); i++) {
            for (int j = i + 1; j < symbols.size(); j++) {
                double correlation = Math.abs(matrix.get(i, j));
                if (correlation > threshold) {
                    pairs.add(new CorrelationPair(symbols.get(i), symbols.get(j),
                            MathUtils.round(correlation, 3)));
                }
            }
        }
        return pairs;
    }

    public double maxAbsoluteCorrelation(CorrelationMatrix matrix) {
        double max = 0.0;
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = i + 1; j < matrix.size(); j++) {
                double correlation = Math.abs(matrix.get(i, j));
                if (!Double.isNaN(correlation)) {
                    max = Math.max(max, correlation);
                }
            }
        }
        return max;
    }
}

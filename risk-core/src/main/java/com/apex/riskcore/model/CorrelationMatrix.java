package com.apex.riskcore.model;

import java.util.List;

/**
 * Pearson correlation matrix over an ordered set of symbols. An empty matrix means there was not
 * enough aligned history to compute one.
 */
public final class CorrelationMatrix {

    private static final CorrelationMatrix EMPTY = new CorrelationMatrix(List.of(), new double[0][0]);

    private final List<String> symbols;
    private final double[][] values;

    public CorrelationMatrix(List<String> symbols, double[][] values) {
        if (values.length != symbols.size()) {
            throw new IllegalArgumentException("Matrix size does not match symbol count");
        }
        this.symbols = List.copyOf(symbols);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public static CorrelationMatrix empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public int size() {
        return symbols.size();
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public boolean contains(String symbol) {
        return symbols.contains(symbol);
    }

    public double get(String first, String second) {
        int i = symbols.indexOf(first);
        int j = symbols.indexOf(second);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Symbol not in correlation matrix: " + (i < 0 ? first : second));
        }
        return values[i][j];
    }

    public double get(int row, int column) {
        return values[row][column];
    }
}

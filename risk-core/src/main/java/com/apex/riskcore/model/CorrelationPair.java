package com.apex.riskcore.model;

public record CorrelationPair(String first, String second, double correlation) {}

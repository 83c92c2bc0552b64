package com.creditintel.backend.pipeline;

public record ModelScore(double score, RiskLevel riskLevel, double confidence) {}

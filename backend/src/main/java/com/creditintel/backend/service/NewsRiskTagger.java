package com.creditintel.backend.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based risk categories for headlines. A category is reported once, however many of its
 * keywords match.
 */
@Service
public class NewsRiskTagger {

    private static final Map<String, List<String>> RISK_KEYWORDS = new LinkedHashMap<>();

    static {
        RISK_KEYWORDS.put("debt", List.of("debt", "loan", "borrowing", "credit", "leverage"));
        RISK_KEYWORDS.put("financial_stress",
                List.of("bankruptcy", "default", "insolvency", "liquidation", "restructuring"));
        RISK_KEYWORDS.put("market_risk", List.of("volatility", "market crash", "bear market", "recession"));
        RISK_KEYWORDS.put("operational_risk", List.of("operational issues", "supply chain", "production problems"));
        RISK_KEYWORDS.put("regulatory_risk", List.of("regulation", "compliance", "legal issues", "lawsuit"));
        RISK_KEYWORDS.put("competition", List.of("competition", "market share loss", "competitive pressure"));
        RISK_KEYWORDS.put("economic_risk", List.of("inflation", "interest rates", "economic downturn", "gdp"));
        RISK_KEYWORDS.put("geopolitical_risk", List.of("trade war", "sanctions", "political instability"));
    }

    public List<String> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> categories = new ArrayList<>();
        RISK_KEYWORDS.forEach((category, keywords) -> {
            if (keywords.stream().anyMatch(lower::contains)) {
                categories.add(category);
            }
        });
        return categories;
    }
}

package com.creditintel.backend.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NewsRiskTaggerTest {

    private final NewsRiskTagger tagger = new NewsRiskTagger();

    @Test
    void tagsEveryMatchingCategoryInCatalogOrder() {
        assertThat(tagger.tag("Lawsuit over LEVERAGE raises bankruptcy fears amid recession"))
                .containsExactly("debt", "financial_stress", "market_risk", "regulatory_risk");
    }

    @Test
    void neutralTextHasNoTags() {
        assertThat(tagger.tag("Company opens new headquarters")).isEmpty();
        assertThat(tagger.tag(null)).isEmpty();
    }
}

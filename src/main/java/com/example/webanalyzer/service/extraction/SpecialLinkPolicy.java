package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.LinkCategory;

/**
 * Как считать ссылки {@code mailto:} и {@code tel:}.
 */
public enum SpecialLinkPolicy {
    INTERNAL(LinkCategory.INTERNAL),
    EXTERNAL(LinkCategory.EXTERNAL);

    private final LinkCategory category;

    SpecialLinkPolicy(LinkCategory category) {
        this.category = category;
    }

    public LinkCategory getCategory() {
        return category;
    }
}

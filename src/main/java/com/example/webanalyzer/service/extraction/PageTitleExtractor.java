package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.WebpageAnalysis;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Текст первого элемента title.
 */
@Component
@Order(2)
public class PageTitleExtractor implements ExtractionPass<String> {

    public static final String NAME = "page_title";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String extract(PageContext context) {
        return DocumentWalker.findFirstElement(context.getDocument(), "title")
                .map(title -> title.wholeText().trim())
                .orElse("");
    }

    @Override
    public void apply(String value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
        builder.pageTitle(value);
    }
}

package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.LinkStats;
import com.example.webanalyzer.model.WebpageAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Подсчёт ссылок (элементов a) по категориям.
 * Каждый элемент a учитывается ровно в одной категории.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class LinksExtractor implements ExtractionPass<LinkStats> {

    public static final String NAME = "links";

    private final LinkClassifier linkClassifier;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public LinkStats extract(PageContext context) {
        LinkClassifier.PageUrl pageUrl = LinkClassifier.PageUrl.of(context.getPageUrl());
        int[] counts = new int[3];

        DocumentWalker.forEachElement(context.getDocument(), "a", anchor -> {
            String href = anchor.hasAttr("href") ? anchor.attr("href") : null;
            switch (linkClassifier.classify(href, pageUrl)) {
                case INTERNAL -> counts[0]++;
                case EXTERNAL -> counts[1]++;
                case INACCESSIBLE -> counts[2]++;
            }
        });

        return new LinkStats(counts[0], counts[1], counts[2]);
    }

    @Override
    public void apply(LinkStats value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
        builder.internalLinks(value.getInternal())
                .externalLinks(value.getExternal())
                .inaccessibleLinks(value.getInaccessible());
    }
}

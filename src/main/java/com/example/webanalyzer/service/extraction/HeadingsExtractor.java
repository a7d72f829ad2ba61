package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.WebpageAnalysis;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Количество заголовков h1..h6. Уровни без заголовков в результат не попадают.
 */
@Component
@Order(3)
public class HeadingsExtractor implements ExtractionPass<Map<String, Integer>> {

    public static final String NAME = "headings";

    private static final Set<String> LEVELS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Integer> extract(PageContext context) {
        Map<String, Integer> headings = new TreeMap<>();
        DocumentWalker.forEachElement(context.getDocument(), element -> {
            String tag = element.normalName().toLowerCase(Locale.ROOT);
            if (LEVELS.contains(tag)) {
                headings.merge(tag, 1, Integer::sum);
            }
        });
        return headings;
    }

    @Override
    public void apply(Map<String, Integer> value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
        builder.headings(value);
    }
}

package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.WebpageAnalysis;
import org.jsoup.nodes.DocumentType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Версия HTML по первому объявлению DOCTYPE.
 */
@Component
@Order(1)
public class HtmlVersionExtractor implements ExtractionPass<String> {

    public static final String NAME = "html_version";

    private static final String PUB_SYS_KEY = "pubSysKey";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String extract(PageContext context) {
        return DocumentWalker.findFirst(context.getDocument(), DocumentType.class)
                .map(HtmlVersionExtractor::versionOf)
                .orElse(WebpageAnalysis.DEFAULT_HTML_VERSION);
    }

    @Override
    public void apply(String value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
        builder.htmlVersion(value);
    }

    /**
     * Системный идентификатор читается только при отсутствии ключевого слова PUBLIC;
     * пустой публичный идентификатор даёт версию по умолчанию.
     */
    static String versionOf(DocumentType doctype) {
        boolean publicDeclared = DocumentType.PUBLIC_KEY.equalsIgnoreCase(doctype.attr(PUB_SYS_KEY));
        String identifier = publicDeclared ? doctype.publicId() : doctype.systemId();
        if (identifier.isEmpty()) {
            return WebpageAnalysis.DEFAULT_HTML_VERSION;
        }

        String lower = identifier.toLowerCase(Locale.ROOT);
        if (lower.contains("html5") || lower.contains("html 5")) {
            return "HTML5";
        }
        if (lower.contains("html4") || lower.contains("html 4")) {
            return "HTML4";
        }
        if (lower.contains("xhtml")) {
            return "XHTML";
        }
        return identifier;
    }
}

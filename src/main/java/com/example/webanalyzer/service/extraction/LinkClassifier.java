package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.config.AnalyzerProperties;
import com.example.webanalyzer.model.LinkCategory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Классификация ссылки по значению href и адресу страницы.
 *
 * Порядок правил:
 * <ol>
 *   <li>нет href или пустой href → INACCESSIBLE;</li>
 *   <li>{@code javascript:} в любом регистре → INACCESSIBLE;</li>
 *   <li>нет схемы и нет ведущего {@code //} → INTERNAL;</li>
 *   <li>{@code mailto:} и {@code tel:} → согласно {@link SpecialLinkPolicy};</li>
 *   <li>{@code ftp:} → EXTERNAL;</li>
 *   <li>{@code //host/path} получает схему страницы;</li>
 *   <li>остальные сравниваются по имени хоста без учёта регистра.</li>
 * </ol>
 * Символы, которые браузер принимает в пути, запросе и фрагменте, но не принимает
 * {@link URI} (пробел, {@code | { } ^ ` < > "} и повторный {@code #}), перед разбором
 * экранируются. Адрес, который не разбирается и после этого (например {@code %zz}
 * или пробел в имени хоста) → INACCESSIBLE. Сеть не используется.
 */
@Component
public class LinkClassifier {

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*:");
    private static final String LENIENT_ESCAPES = " |{}^`<>\"";

    private final SpecialLinkPolicy specialLinkPolicy;

    @Autowired
    public LinkClassifier(AnalyzerProperties properties) {
        this(properties.getLinks().getSpecialLinkPolicy());
    }

    public LinkClassifier(SpecialLinkPolicy specialLinkPolicy) {
        this.specialLinkPolicy = specialLinkPolicy != null ? specialLinkPolicy : SpecialLinkPolicy.INTERNAL;
    }

    public SpecialLinkPolicy getSpecialLinkPolicy() {
        return specialLinkPolicy;
    }

    public LinkCategory classify(String href, String pageUrl) {
        return classify(href, PageUrl.of(pageUrl));
    }

    /**
     * @param href    значение атрибута href, {@code null} если атрибута нет
     * @param pageUrl разобранный адрес страницы
     */
    public LinkCategory classify(String href, PageUrl pageUrl) {
        if (href == null || href.isEmpty()) {
            return LinkCategory.INACCESSIBLE;
        }

        String lower = href.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:")) {
            return LinkCategory.INACCESSIBLE;
        }

        boolean protocolRelative = href.startsWith("//");
        if (!protocolRelative && !SCHEME.matcher(href).find()) {
            return LinkCategory.INTERNAL;
        }

        if (lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return specialLinkPolicy.getCategory();
        }
        if (lower.startsWith("ftp:")) {
            return LinkCategory.EXTERNAL;
        }

        String absolute = href;
        if (protocolRelative) {
            if (pageUrl.getScheme() == null) {
                return LinkCategory.EXTERNAL;
            }
            absolute = pageUrl.getScheme() + ":" + href;
        }

        URI target;
        try {
            target = new URI(escapeLenient(absolute));
        } catch (URISyntaxException e) {
            return LinkCategory.INACCESSIBLE;
        }

        String targetHost = hostOf(target);
        if (pageUrl.getHost() != null && targetHost != null && targetHost.equalsIgnoreCase(pageUrl.getHost())) {
            return LinkCategory.INTERNAL;
        }
        return LinkCategory.EXTERNAL;
    }

    /**
     * Экранирует после authority символы, которые {@link URI} отвергает, а браузер принимает.
     * Authority и {@code %} не трогаются.
     */
    static String escapeLenient(String absolute) {
        int restStart = absolute.indexOf(':') + 1;
        if (absolute.startsWith("//", restStart)) {
            restStart += 2;
            while (restStart < absolute.length() && "/?#".indexOf(absolute.charAt(restStart)) < 0) {
                restStart++;
            }
        }

        StringBuilder escaped = new StringBuilder(absolute.length() + 8).append(absolute, 0, restStart);
        boolean inFragment = false;
        for (int i = restStart; i < absolute.length(); i++) {
            char c = absolute.charAt(i);
            if (c == '#') {
                if (inFragment) {
                    escaped.append("%23");
                } else {
                    inFragment = true;
                    escaped.append(c);
                }
            } else if (LENIENT_ESCAPES.indexOf(c) >= 0) {
                escaped.append('%').append(String.format("%02X", (int) c));
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /**
     * Имя хоста; для хостов, которые {@link URI} не признаёт серверными (например с '_'),
     * выделяется из authority.
     */
    static String hostOf(URI uri) {
        String host = uri.getHost();
        if (host != null) {
            return host;
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        if (!authority.startsWith("[")) {
            int colon = authority.lastIndexOf(':');
            if (colon >= 0) {
                authority = authority.substring(0, colon);
            }
        }
        return authority.isEmpty() ? null : authority;
    }

    /**
     * Адрес страницы, разобранный один раз на проход.
     */
    public static final class PageUrl {
        private final String scheme;
        private final String host;

        private PageUrl(String scheme, String host) {
            this.scheme = scheme;
            this.host = host;
        }

        public static PageUrl of(String pageUrl) {
            if (pageUrl == null) {
                return new PageUrl(null, null);
            }
            try {
                URI uri = new URI(pageUrl.trim());
                return new PageUrl(uri.getScheme(), hostOf(uri));
            } catch (URISyntaxException e) {
                return new PageUrl(null, null);
            }
        }

        public String getScheme() {
            return scheme;
        }

        public String getHost() {
            return host;
        }
    }
}

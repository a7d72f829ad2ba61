package com.example.webanalyzer.service.parse;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор HTML через jsoup. Кодировка берётся из Content-Type, иначе определяется jsoup
 * по BOM и meta-тегам.
 */
@Slf4j
@Service
public class JsoupDocumentParser implements DocumentParser {

    private static final Pattern CHARSET = Pattern.compile("charset\\s*=\\s*[\"']?([^\\s;\"']+)", Pattern.CASE_INSENSITIVE);

    @Override
    public Document parse(byte[] content, String contentType, String baseUrl) throws DocumentParseException {
        if (content == null) {
            throw new DocumentParseException("Failed to parse HTML: no content");
        }
        String charset = charsetOf(contentType);
        try {
            Document document = Jsoup.parse(new ByteArrayInputStream(content), charset, baseUrl == null ? "" : baseUrl);
            log.debug("Parsed {} bytes from {} (charset {})", content.length, baseUrl, document.charset());
            return document;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            throw new DocumentParseException("Failed to parse HTML: " + e.getMessage(), e);
        }
    }

    /**
     * Кодировка из Content-Type, если она указана и поддерживается JVM.
     */
    static String charsetOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).trim().toUpperCase(Locale.ROOT);
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("Ignoring unknown charset '{}'", name);
            return null;
        }
    }
}

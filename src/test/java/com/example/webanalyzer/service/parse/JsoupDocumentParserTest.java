package com.example.webanalyzer.service.parse;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsoupDocumentParserTest {

    private final JsoupDocumentParser parser = new JsoupDocumentParser();

    @Test
    void shouldParseWithDeclaredCharset() throws Exception {
        // Given
        byte[] content = "<html><head><title>Café</title></head></html>".getBytes(StandardCharsets.ISO_8859_1);

        // When
        Document document = parser.parse(content, "text/html; charset=ISO-8859-1", "https://example.com/");

        // Then
        assertEquals("Café", document.title());
        assertEquals("https://example.com/", document.location());
    }

    @Test
    void shouldDetectCharsetWhenHeaderMissing() throws Exception {
        byte[] content = "<html><head><meta charset=\"utf-8\"><title>Привет</title></head></html>"
                .getBytes(StandardCharsets.UTF_8);

        Document document = parser.parse(content, null, "https://example.com/");

        assertEquals("Привет", document.title());
    }

    @Test
    void shouldRepairMalformedMarkup() throws Exception {
        byte[] content = "<p>unclosed <b>bold<div>block".getBytes(StandardCharsets.UTF_8);

        Document document = parser.parse(content, "text/html", "https://example.com/");

        assertNotNull(document.body());
        assertEquals(1, document.getElementsByTag("div").size());
    }

    @Test
    void shouldRejectMissingContent() {
        assertThrows(DocumentParseException.class, () -> parser.parse(null, "text/html", "https://example.com/"));
    }

    @Test
    void shouldExtractCharsetFromContentType() {
        assertEquals("UTF-8", JsoupDocumentParser.charsetOf("text/html; charset=\"UTF-8\""));
        assertNull(JsoupDocumentParser.charsetOf("text/html"));
        assertNull(JsoupDocumentParser.charsetOf("text/html; charset=no-such-charset"));
        assertNull(JsoupDocumentParser.charsetOf(null));
    }
}

package com.example.webanalyzer.service.parse;

/**
 * Содержимое не удалось превратить в дерево документа.
 */
public class DocumentParseException extends Exception {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

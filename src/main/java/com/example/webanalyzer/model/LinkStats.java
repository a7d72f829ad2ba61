package com.example.webanalyzer.model;

import lombok.Value;

/**
 * Счётчики ссылок по категориям.
 */
@Value
public class LinkStats {

    int internal;
    int external;
    int inaccessible;

    public int getTotal() {
        return internal + external + inaccessible;
    }
}

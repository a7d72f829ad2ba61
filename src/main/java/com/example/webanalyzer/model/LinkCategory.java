package com.example.webanalyzer.model;

/**
 * Категория гиперссылки.
 */
public enum LinkCategory {
    /**
     * Ссылка на тот же сайт (относительная или с тем же хостом)
     */
    INTERNAL,

    /**
     * Ссылка на другой сайт
     */
    EXTERNAL,

    /**
     * Ссылка без адреса, javascript: или некорректный URL
     */
    INACCESSIBLE
}

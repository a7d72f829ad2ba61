package com.example.webanalyzer.service.extraction;

/**
 * Признаки формы входа.
 */
public enum LoginSignal {
    /**
     * В форме есть поле input[type=password]; обязательный признак
     */
    PASSWORD_FIELD,

    /**
     * action/id/name/class формы содержит login, signin, auth и т.п., либо у формы есть data-auth/data-login
     */
    ATTRIBUTE_PATTERN,

    /**
     * autocomplete со значением username, current-password или new-password
     */
    AUTOCOMPLETE_HINT,

    /**
     * Текст формы содержит фразу вроде "sign in to", "welcome back", "enter your"
     */
    CONTEXT_PHRASE,

    /**
     * Кнопка отправки с текстом вроде "Login", "Sign in", "Continue"
     */
    SUBMIT_LABEL,

    /**
     * name/id поля содержит username, email, password и т.п.
     */
    FIELD_NAME
}

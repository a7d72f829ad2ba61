package com.example.webanalyzer.service.extraction;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Эвристика формы входа.
 *
 * Форма считается формой входа, если в ней есть поле пароля и хотя бы ещё один признак
 * из {@link LoginSignal}. Без поля пароля форма не считается формой входа, даже если в ней
 * есть поле "user" (формы обратной связи, поиска). Все сравнения: поиск подстроки без учёта
 * регистра.
 */
@Component
public class LoginFormDetector {

    private static final List<String> FORM_ATTRIBUTES = List.of("action", "id", "name", "class");

    private static final List<String> LOGIN_PATTERNS = List.of(
            "login", "signin", "sign_in", "sign-in",
            "authenticate", "auth", "authentication",
            "logon", "signon", "sign_on", "sign-on"
    );

    private static final List<String> AUTH_DATA_ATTRIBUTES = List.of("data-auth", "data-login");

    private static final List<String> AUTOCOMPLETE_HINTS = List.of("username", "current-password", "new-password");

    private static final List<String> CONTEXT_PHRASES = List.of(
            "sign in to", "log in to", "login to",
            "welcome back", "welcome to",
            "enter your", "provide your",
            "access your account", "access account",
            "your credentials", "your password",
            "authentication required", "login required"
    );

    private static final List<String> INPUT_LABELS = List.of(
            "username", "user id", "userid", "user-id",
            "email address", "email addr", "e-mail",
            "password", "passwd", "pass word", "pass-word"
    );

    private static final List<String> SUBMIT_WORDS = List.of(
            "login", "sign in", "signin", "log in",
            "authenticate", "continue", "submit",
            "enter", "access", "proceed"
    );

    private static final List<String> FIELD_KEYWORDS = List.of(
            "username", "userid", "user_id", "user-name",
            "password", "passwd", "pass_word", "pass-word",
            "login", "email"
    );

    /**
     * Является ли форма формой входа.
     */
    public boolean isLoginForm(Element form) {
        Set<LoginSignal> signals = evaluate(form);
        return signals.contains(LoginSignal.PASSWORD_FIELD) && signals.size() > 1;
    }

    /**
     * Все признаки, найденные в форме.
     */
    public Set<LoginSignal> evaluate(Element form) {
        Set<LoginSignal> signals = EnumSet.noneOf(LoginSignal.class);

        if (hasLoginPattern(form)) {
            signals.add(LoginSignal.ATTRIBUTE_PATTERN);
        }

        DocumentWalker.forEachElement(form, element -> {
            if (containsAny(element.attr("autocomplete"), AUTOCOMPLETE_HINTS)) {
                signals.add(LoginSignal.AUTOCOMPLETE_HINT);
            }
            String tag = element.normalName();
            if ("input".equals(tag)) {
                inspectInput(element, signals);
            } else if ("button".equals(tag) && isSubmitButton(element)
                    && containsAny(DocumentWalker.text(element), SUBMIT_WORDS)) {
                signals.add(LoginSignal.SUBMIT_LABEL);
            }
        });

        String text = DocumentWalker.text(form);
        if (containsAny(text, CONTEXT_PHRASES) || containsAny(text, INPUT_LABELS)) {
            signals.add(LoginSignal.CONTEXT_PHRASE);
        }

        return signals;
    }

    private void inspectInput(Element input, Set<LoginSignal> signals) {
        String type = input.attr("type");
        if ("password".equalsIgnoreCase(type)) {
            signals.add(LoginSignal.PASSWORD_FIELD);
        }
        if ("submit".equalsIgnoreCase(type) && containsAny(input.attr("value"), SUBMIT_WORDS)) {
            signals.add(LoginSignal.SUBMIT_LABEL);
        }
        if (containsAny(input.attr("name"), FIELD_KEYWORDS) || containsAny(input.attr("id"), FIELD_KEYWORDS)) {
            signals.add(LoginSignal.FIELD_NAME);
        }
    }

    private boolean hasLoginPattern(Element form) {
        for (String attribute : FORM_ATTRIBUTES) {
            if (containsAny(form.attr(attribute), LOGIN_PATTERNS)) {
                return true;
            }
        }
        for (Attribute attribute : form.attributes()) {
            String key = attribute.getKey().toLowerCase(Locale.ROOT);
            for (String fragment : AUTH_DATA_ATTRIBUTES) {
                if (key.contains(fragment)) {
                    return true;
                }
            }
        }
        return false;
    }

    // <button> без type по умолчанию отправляет форму
    private static boolean isSubmitButton(Element button) {
        String type = button.attr("type");
        return type.isEmpty() || "submit".equalsIgnoreCase(type);
    }

    private static boolean containsAny(String value, List<String> needles) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}

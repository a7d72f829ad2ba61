package com.example.webanalyzer.service.extraction;

import com.example.webanalyzer.model.WebpageAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Есть ли на странице форма входа.
 */
@Slf4j
@Component
@Order(5)
@RequiredArgsConstructor
public class LoginFormExtractor implements ExtractionPass<Boolean> {

    public static final String NAME = "login_form";

    private final LoginFormDetector loginFormDetector;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Boolean extract(PageContext context) {
        Optional<Element> loginForm = DocumentWalker.findFirst(context.getDocument(),
                        node -> node instanceof Element
                                && "form".equals(((Element) node).normalName())
                                && loginFormDetector.isLoginForm((Element) node))
                .map(Element.class::cast);

        loginForm.ifPresent(form -> log.debug("Login form found on {}: signals {}",
                context.getPageUrl(), loginFormDetector.evaluate(form)));
        return loginForm.isPresent();
    }

    @Override
    public void apply(Boolean value, WebpageAnalysis.WebpageAnalysisBuilder builder) {
        builder.loginForm(value);
    }
}

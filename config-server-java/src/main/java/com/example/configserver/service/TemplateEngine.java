package com.example.configserver.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{ NAME }}} placeholders with values from a variable map. Unknown names
 * are left untouched and substituted values are never rescanned.
 */
@Component
public class TemplateEngine {
    public static final String DEFAULT_PLACEHOLDER = "\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\}\\}";

    private final Pattern placeholder;

    public TemplateEngine() {
        this(Pattern.compile(DEFAULT_PLACEHOLDER));
    }

    /**
     * @param placeholder pattern whose first group captures the variable name
     */
    public TemplateEngine(Pattern placeholder) {
        this.placeholder = placeholder;
    }

    public String substitute(String text, Map<String, String> variables) {
        Matcher matcher = placeholder.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        matcher.reset();
        return matcher.replaceAll(match -> {
            String value = variables.get(match.group(1));
            return Matcher.quoteReplacement(value != null ? value : match.group());
        });
    }
}

package com.kincircle.trust.service;

import com.kincircle.trust.service.model.RedactionRule;
import com.kincircle.trust.service.model.RedactionSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Scrubs personal data from free text before it leaves the device.
 *
 * <p>Rules run in order: configured names first, then emails, phone numbers and
 * SSN-like numbers. Tokens already present in the input are left untouched, and the
 * rules are re-run until the text is stable, so redacting twice gives the same result
 * as redacting once.
 */
@Component
public class PrivacyRedactor {

    public static final String NAME_TOKEN = "[REDACTED]";
    public static final String EMAIL_TOKEN = "[EMAIL_REDACTED]";
    public static final String PHONE_TOKEN = "[PHONE_REDACTED]";
    public static final String SSN_TOKEN = "[SSN_REDACTED]";

    private static final Pattern TOKEN = Pattern.compile("\\[(?:EMAIL_|PHONE_|SSN_)?REDACTED]");

    private static final List<RedactionRule> CATEGORY_RULES = List.of(
            new RedactionRule(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b"), EMAIL_TOKEN),
            new RedactionRule(Pattern.compile("(\\+\\d{1,2}\\s?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}"), PHONE_TOKEN),
            new RedactionRule(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), SSN_TOKEN)
    );

    public String redact(String text, RedactionSettings settings) {
        if (text == null || settings == null || !settings.privacyMode()) return text;

        List<RedactionRule> rules = rulesFor(settings);
        // a new token can expose a word boundary next to a name, so run to a fixed point
        String current = text;
        String next = pass(rules, current);
        while (!next.equals(current)) {
            current = next;
            next = pass(rules, current);
        }
        return current;
    }

    private static String pass(List<RedactionRule> rules, String text) {
        StringBuilder out = new StringBuilder(text.length());
        Matcher token = TOKEN.matcher(text);
        int last = 0;
        while (token.find()) {
            out.append(apply(rules, text.substring(last, token.start())));
            out.append(token.group());
            last = token.end();
        }
        out.append(apply(rules, text.substring(last)));
        return out.toString();
    }

    /** Name rules for the subject and extra names, followed by the category rules. */
    public List<RedactionRule> rulesFor(RedactionSettings settings) {
        List<RedactionRule> rules = new ArrayList<>();
        Stream.concat(Stream.of(settings.subjectName()), settings.extraNames().stream())
                .filter(n -> n != null && !n.isBlank())
                .map(String::trim)
                .distinct()
                .forEach(n -> rules.add(nameRule(n)));
        rules.addAll(CATEGORY_RULES);
        return rules;
    }

    // the name is quoted, so regex metacharacters in it are literal
    static RedactionRule nameRule(String name) {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(name) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new RedactionRule(p, NAME_TOKEN);
    }

    private static String apply(List<RedactionRule> rules, String segment) {
        String clean = segment;
        for (RedactionRule rule : rules) {
            clean = rule.apply(clean);
        }
        return clean;
    }
}

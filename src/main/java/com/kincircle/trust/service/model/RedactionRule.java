package com.kincircle.trust.service.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record RedactionRule(Pattern pattern, String replacement) {

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}

package com.kincircle.trust.service;

import com.kincircle.trust.service.model.RedactionSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrivacyRedactorTest {

    private final PrivacyRedactor redactor = new PrivacyRedactor();

    private final RedactionSettings on = new RedactionSettings("Mom", true);

    @Test
    void redactsNameAndPhone() {
        assertThat(redactor.redact("Call Mom at 555-123-4567", on))
                .isEqualTo("Call [REDACTED] at [PHONE_REDACTED]");
    }

    @Test
    void privacyModeOffLeavesTextAlone() {
        String text = "Call Mom at 555-123-4567, mail mom@example.com";

        assertThat(redactor.redact(text, new RedactionSettings("Mom", false))).isSameAs(text);
        assertThat(redactor.redact(text, null)).isSameAs(text);
        assertThat(redactor.redact(null, on)).isNull();
    }

    @Test
    void redactingTwiceChangesNothing() {
        RedactionSettings ann = new RedactionSettings("Ann", true);
        List<String> inputs = List.of(
                "Mom (mom@example.com) 123-45-6789 +1 (555) 123-4567",
                "Ann555-123-4567",
                "555-123-4567Ann and ann@example.comAnn",
                "Ann123-45-6789Ann");

        for (String input : inputs) {
            String once = redactor.redact(input, ann);
            assertThat(redactor.redact(once, ann)).as(input).isEqualTo(once);
        }
        String once = redactor.redact(inputs.get(0), on);
        assertThat(redactor.redact(once, on)).isEqualTo(once);
    }

    @Test
    void nameGluedToPhoneNumberIsRedactedInOneCall() {
        RedactionSettings ann = new RedactionSettings("Ann", true);

        assertThat(redactor.redact("Ann555-123-4567", ann)).isEqualTo("[REDACTED][PHONE_REDACTED]");
        assertThat(redactor.redact("Annabel555-123-4567", ann)).isEqualTo("Annabel[PHONE_REDACTED]");
    }

    @Test
    void existingTokensSurvive() {
        assertThat(redactor.redact("[REDACTED] left [PHONE_REDACTED] for Mom", on))
                .isEqualTo("[REDACTED] left [PHONE_REDACTED] for [REDACTED]");
    }

    @Test
    void nameMatchIsWholeWordAndCaseInsensitive() {
        assertThat(redactor.redact("MOM, mom and Momentum", on))
                .isEqualTo("[REDACTED], [REDACTED] and Momentum");
    }

    @Test
    void regexMetacharactersInNamesAreLiteral() {
        RedactionSettings s = new RedactionSettings("J.R", true);

        assertThat(redactor.redact("J.R visited, JXR did not", s))
                .isEqualTo("[REDACTED] visited, JXR did not");
    }

    @Test
    void extraNamesAreRedactedToo() {
        RedactionSettings s = new RedactionSettings("Margaret", true, List.of("Tom", " Ann ", ""));

        assertThat(redactor.redact("Margaret asked Tom and Ann about Annabel", s))
                .isEqualTo("[REDACTED] asked [REDACTED] and [REDACTED] about Annabel");
    }

    @Test
    void emailAndSsnCategories() {
        RedactionSettings s = new RedactionSettings(null, true);

        assertThat(redactor.redact("Write to alice.b@example.org or use 123-45-6789", s))
                .isEqualTo("Write to [EMAIL_REDACTED] or use [SSN_REDACTED]");
    }

    @Test
    void phoneVariants() {
        RedactionSettings s = new RedactionSettings("", true);

        assertThat(redactor.redact("(555) 123-4567", s)).isEqualTo("[PHONE_REDACTED]");
        assertThat(redactor.redact("555.123.4567 or 5551234567", s))
                .isEqualTo("[PHONE_REDACTED] or [PHONE_REDACTED]");
    }

    @Test
    void rulesListNamesFirst() {
        var rules = redactor.rulesFor(new RedactionSettings("Mom", true, List.of("Dad", "Mom")));

        assertThat(rules).hasSize(5);
        assertThat(rules.get(0).replacement()).isEqualTo(PrivacyRedactor.NAME_TOKEN);
        assertThat(rules.get(1).replacement()).isEqualTo(PrivacyRedactor.NAME_TOKEN);
        assertThat(rules.get(2).replacement()).isEqualTo(PrivacyRedactor.EMAIL_TOKEN);
    }
}

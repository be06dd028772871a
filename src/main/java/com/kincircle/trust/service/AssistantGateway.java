package com.kincircle.trust.service;

import com.kincircle.trust.service.error.AssistantUnavailableException;
import com.kincircle.trust.service.model.Permission;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.RedactionSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Trust boundary in front of the billed chat assistant: permission, then budget,
 * then redaction, and only then the remote call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssistantGateway {

    public static final String CHAT_BUDGET = "chat-api";

    private final PermissionMatrix permissions;
    private final RateLimiterRegistry rateLimiters;
    private final PrivacyRedactor redactor;
    private final AssistantClient client;

    public String ask(Principal principal, String question, List<String> context, RedactionSettings privacy) {
        permissions.requirePermission(principal, Permission.ENTRIES_READ, "ask the assistant");
        rateLimiters.acquire(CHAT_BUDGET);

        String cleanQuestion = redactor.redact(question, privacy);
        List<String> cleanContext = context == null ? List.of()
                : context.stream().map(c -> redactor.redact(c, privacy)).toList();
        log.debug("Assistant query from {} with {} context lines", principal.id(), cleanContext.size());

        AssistantClient.Reply reply = client.query(cleanQuestion, cleanContext);
        if (reply == null || reply.getAnswer() == null) {
            throw new AssistantUnavailableException("Assistant returned an empty reply");
        }
        return reply.getAnswer();
    }
}

package com.kincircle.trust.controller;

import com.kincircle.trust.controller.dto.AssistantDtos.*;
import com.kincircle.trust.service.AssistantGateway;
import com.kincircle.trust.service.SessionGuard;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.SessionState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private final AssistantGateway gateway;
    private final SessionGuard sessionGuard;

    @PostMapping("/query")
    public QueryResponse query(Principal principal, @Valid @RequestBody QueryRequest req) {
        if (sessionGuard.getState() == SessionState.LOCKED) {
            throw new ResponseStatusException(HttpStatus.LOCKED, "session is locked");
        }
        return new QueryResponse(gateway.ask(principal, req.question, req.context, req.privacy()));
    }
}

package com.kincircle.trust.controller;

import com.kincircle.trust.controller.dto.PrivacyDtos.*;
import com.kincircle.trust.service.PrivacyRedactor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/privacy")
@RequiredArgsConstructor
public class PrivacyController {

    private final PrivacyRedactor redactor;

    @PostMapping("/redact")
    public RedactResponse redact(@Valid @RequestBody RedactRequest req) {
        return new RedactResponse(redactor.redact(req.text, req.settings()));
    }
}

package com.hookrelay.controller;

import com.hookrelay.dto.ErrorResponse;
import com.hookrelay.dto.HookParams;
import com.hookrelay.dto.SuccessResponse;
import com.hookrelay.model.HookOutcome;
import com.hookrelay.provider.WebhookRequest;
import com.hookrelay.service.HookService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

/**
 * Webhook endpoint. Point the code host's webhook at either form:
 *
 *   POST /h/{service-id}/{app-slug}/{api-token}
 *   POST /h?service_id=github&app_slug=...&api_token=...
 *
 * 200 {"message": "..."} when the hook was handled or skipped,
 * 400 {"errors": [...]} for every kind of rejection.
 */
@RestController
@RequiredArgsConstructor
public class HookController {

    private final HookService hookService;

    @GetMapping("/")
    public SuccessResponse root() {
        return new SuccessResponse("Welcome to hook-relay!");
    }

    @PostMapping("/h/{service-id}/{app-slug}/{api-token}")
    public ResponseEntity<Object> receive(@PathVariable("service-id") String serviceId,
                                          @PathVariable("app-slug") String appSlug,
                                          @PathVariable("api-token") String apiToken,
                                          HttpServletRequest request) throws IOException {
        return handle(new HookParams(serviceId, appSlug, apiToken), request);
    }

    @PostMapping("/h")
    public ResponseEntity<Object> receiveWithQuery(
            @RequestParam(name = "service_id", required = false) String serviceId,
            @RequestParam(name = "app_slug", required = false) String appSlug,
            @RequestParam(name = "api_token", required = false) String apiToken,
            HttpServletRequest request) throws IOException {
        return handle(new HookParams(serviceId, appSlug, apiToken), request);
    }

    private ResponseEntity<Object> handle(HookParams params, HttpServletRequest request) throws IOException {
        HookOutcome outcome = hookService.handle(params, WebhookRequest.from(request));
        if (outcome.isAccepted()) {
            return ResponseEntity.ok(new SuccessResponse(outcome.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(outcome.getErrors()));
    }
}

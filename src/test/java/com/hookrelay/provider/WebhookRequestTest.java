package com.hookrelay.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookRequestTest {

    @Test
    @DisplayName("header lookup ignores case")
    void header_shouldBeCaseInsensitive() {
        WebhookRequest request = WebhookRequest.builder().header("X-GitHub-Event", "push").build();

        assertEquals("push", request.header("x-github-event"));
        assertNull(request.header("X-Other"));
    }

    @Test
    @DisplayName("snapshots of the same bytes are equal")
    void equalSnapshots_shouldBeEqual() {
        WebhookRequest a = WebhookRequest.builder().contentType("application/json")
                .header("X-GitHub-Event", "push").body("{}".getBytes(StandardCharsets.UTF_8)).build();
        WebhookRequest b = WebhookRequest.builder().contentType("application/json")
                .header("x-github-event", "push").body("{}".getBytes(StandardCharsets.UTF_8)).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    @DisplayName("the body cannot be changed through the getter")
    void body_shouldBeDefensivelyCopied() {
        WebhookRequest request = WebhookRequest.builder().body(new byte[]{1, 2}).build();

        request.getBody()[0] = 9;

        assertEquals(1, request.getBody()[0]);
    }

    @Test
    @DisplayName("from() captures content type, headers and body of a servlet request")
    void from_shouldCaptureServletRequest() throws Exception {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("POST", "/h/github/slug/token");
        servletRequest.setContentType("application/json");
        servletRequest.addHeader("X-GitHub-Event", "ping");
        servletRequest.setContent("{\"zen\":\"Keep it logically awesome.\"}".getBytes(StandardCharsets.UTF_8));

        WebhookRequest request = WebhookRequest.from(servletRequest);

        assertEquals("application/json", request.getContentType());
        assertEquals("ping", request.header("X-GitHub-Event"));
        assertEquals("{\"zen\":\"Keep it logically awesome.\"}", request.bodyAsString());
        assertTrue(request.hasBody());
    }

    @Test
    @DisplayName("missing body becomes an empty one")
    void noBody_shouldBeEmpty() {
        WebhookRequest request = WebhookRequest.builder().build();

        assertFalse(request.hasBody());
        assertEquals("", request.bodyAsString());
    }
}

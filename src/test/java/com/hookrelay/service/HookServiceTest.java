package com.hookrelay.service;

import com.hookrelay.dto.HookParams;
import com.hookrelay.dto.TriggerParams;
import com.hookrelay.exception.NoEventDetectedException;
import com.hookrelay.exception.TriggerDispatchException;
import com.hookrelay.model.HookOutcome;
import com.hookrelay.model.TransformResult;
import com.hookrelay.provider.HookProvider;
import com.hookrelay.provider.ProviderRegistry;
import com.hookrelay.provider.WebhookRequest;
import com.hookrelay.trigger.BuildTriggerClient;
import com.hookrelay.trigger.TriggerDispatcher;
import com.hookrelay.trigger.TriggerUrlResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for HookService, the whole pipeline from caller parameters to the
 * composed outcome.
 *
 * The provider and the build trigger client are mocks; registry, URL resolver,
 * dispatcher and composer are the real ones, so these tests exercise the same
 * wiring the application uses.
 */
@ExtendWith(MockitoExtension.class)
class HookServiceTest {

    private static final String SERVICE_ID = "fake";
    private static final String APP_SLUG = "app-123";
    private static final String API_TOKEN = "token-abc";
    private static final URI EXPECTED_URL = URI.create("https://app.bitrise.io/app/app-123/build/start.json");

    @Mock private HookProvider provider;
    @Mock private BuildTriggerClient buildTriggerClient;

    private HookService hookService;
    private WebhookRequest request;

    @BeforeEach
    void setUp() {
        lenient().when(provider.serviceId()).thenReturn(SERVICE_ID);

        hookService = new HookService(
                ProviderRegistry.of(provider),
                new TriggerUrlResolver("https://app.bitrise.io", null),
                new TriggerDispatcher(buildTriggerClient, 1),
                new OutcomeComposer());

        request = WebhookRequest.builder()
                .contentType("application/json")
                .header("X-Event", "push")
                .body("{\"ref\":\"main\"}".getBytes(StandardCharsets.UTF_8))
                .build();
    }

    private static HookParams params() {
        return new HookParams(SERVICE_ID, APP_SLUG, API_TOKEN);
    }

    private static TriggerParams branch(String name) {
        return TriggerParams.builder().branch(name).commitHash("sha-" + name).build();
    }

    @Nested
    @DisplayName("Missing caller parameters")
    class MissingParameterTests {

        @Test
        @DisplayName("missing service id is reported by name")
        void missingServiceId_shouldReject() {
            HookOutcome outcome = hookService.handle(new HookParams(null, APP_SLUG, API_TOKEN), request);

            assertFalse(outcome.isAccepted());
            assertEquals(List.of("No service-id defined"), outcome.getErrors());
        }

        @Test
        @DisplayName("missing app slug is reported by name")
        void missingAppSlug_shouldReject() {
            HookOutcome outcome = hookService.handle(new HookParams(SERVICE_ID, "", API_TOKEN), request);

            assertFalse(outcome.isAccepted());
            assertEquals(List.of("No App Slug parameter defined"), outcome.getErrors());
        }

        @Test
        @DisplayName("missing API token is reported by name")
        void missingApiToken_shouldReject() {
            HookOutcome outcome = hookService.handle(new HookParams(SERVICE_ID, APP_SLUG, "  "), request);

            assertFalse(outcome.isAccepted());
            assertEquals(List.of("No API Token parameter defined"), outcome.getErrors());
        }

        @Test
        @DisplayName("several missing parameters report only the first")
        void severalMissing_shouldReportFirst() {
            HookOutcome outcome = hookService.handle(new HookParams(SERVICE_ID, null, null), request);

            assertEquals(List.of("No App Slug parameter defined"), outcome.getErrors());
        }

        @Test
        @DisplayName("validation fails before the provider is consulted")
        void missingParameter_shouldNotTransform() {
            hookService.handle(new HookParams(null, null, null), request);

            verify(provider, never()).transform(any());
            verifyNoInteractions(buildTriggerClient);
        }
    }

    @Test
    @DisplayName("unknown service id is rejected with the id in the error")
    void unknownProvider_shouldReject() {
        HookOutcome outcome = hookService.handle(new HookParams("gitlab-ce", APP_SLUG, API_TOKEN), request);

        assertFalse(outcome.isAccepted());
        assertEquals(1, outcome.getErrors().size());
        assertTrue(outcome.getErrors().get(0).contains("gitlab-ce"));
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("skip is acknowledged with the reason in the message")
    void skip_shouldAcknowledge() {
        when(provider.transform(request)).thenReturn(TransformResult.skip("X"));

        HookOutcome outcome = hookService.handle(params(), request);

        assertTrue(outcome.isAccepted());
        assertTrue(outcome.getMessage().contains("X"));
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("transform error is rejected and wraps the provider's text")
    void transformError_shouldReject() {
        when(provider.transform(request)).thenReturn(TransformResult.error("bad payload"));

        HookOutcome outcome = hookService.handle(params(), request);

        assertFalse(outcome.isAccepted());
        assertEquals(List.of("Failed to transform the webhook: bad payload"), outcome.getErrors());
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("zero trigger params is rejected as 'no event detected'")
    void zeroParams_shouldReject() {
        when(provider.transform(request)).thenReturn(TransformResult.triggers(List.of()));

        HookOutcome outcome = hookService.handle(params(), request);

        assertFalse(outcome.isAccepted());
        assertEquals(List.of(NoEventDetectedException.MESSAGE), outcome.getErrors());
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("a provider that throws is rejected as a transform failure")
    void providerThrows_shouldReject() {
        when(provider.transform(request)).thenThrow(new IllegalStateException("boom"));

        HookOutcome outcome = hookService.handle(params(), request);

        assertFalse(outcome.isAccepted());
        assertEquals(List.of("Failed to transform the webhook: boom"), outcome.getErrors());
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("a malformed trigger base URL is rejected for this request only")
    void badBaseUrl_shouldReject() {
        hookService = new HookService(
                ProviderRegistry.of(provider),
                new TriggerUrlResolver("not a url", null),
                new TriggerDispatcher(buildTriggerClient, 1),
                new OutcomeComposer());
        when(provider.transform(request)).thenReturn(TransformResult.trigger(branch("main")));

        HookOutcome outcome = hookService.handle(params(), request);

        assertFalse(outcome.isAccepted());
        assertEquals(1, outcome.getErrors().size());
        assertTrue(outcome.getErrors().get(0).startsWith("Failed to create Build Trigger URL: "));
        verifyNoInteractions(buildTriggerClient);
    }

    @Test
    @DisplayName("one trigger param that succeeds reports 1 build")
    void singleTrigger_shouldSucceed() {
        TriggerParams main = branch("main");
        when(provider.transform(request)).thenReturn(TransformResult.trigger(main));

        HookOutcome outcome = hookService.handle(params(), request);

        assertTrue(outcome.isAccepted());
        assertEquals("Successfully triggered 1 build.", outcome.getMessage());
        verify(buildTriggerClient).trigger(EXPECTED_URL, API_TOKEN, main);
    }

    @Test
    @DisplayName("several trigger params that succeed report the plural count")
    void multipleTriggers_shouldSucceed() {
        when(provider.transform(request)).thenReturn(
                TransformResult.triggers(List.of(branch("a"), branch("b"))));

        HookOutcome outcome = hookService.handle(params(), request);

        assertEquals("Successfully triggered 2 builds.", outcome.getMessage());
        verify(buildTriggerClient, times(2)).trigger(eq(EXPECTED_URL), eq(API_TOKEN), any());
    }

    @Test
    @DisplayName("failure of the 2nd of 3 triggers gives one error and all 3 calls")
    void partialFailure_shouldAttemptAll() {
        TriggerParams first = branch("a");
        TriggerParams second = branch("b");
        TriggerParams third = branch("c");
        when(provider.transform(request)).thenReturn(TransformResult.triggers(List.of(first, second, third)));
        doAnswer(invocation -> {
            if (second.equals(invocation.getArgument(2))) {
                throw new TriggerDispatchException("HTTP 500");
            }
            return null;
        }).when(buildTriggerClient).trigger(any(), any(), any());

        HookOutcome outcome = hookService.handle(params(), request);

        assertFalse(outcome.isAccepted());
        assertEquals(List.of("Failed to Trigger the Build: HTTP 500"), outcome.getErrors());
        verify(buildTriggerClient, times(3)).trigger(eq(EXPECTED_URL), eq(API_TOKEN), any());
    }

    @Test
    @DisplayName("override URL is used instead of the app slug endpoint")
    void overrideUrl_shouldBeUsed() {
        URI override = URI.create("http://localhost:3000/echo");
        hookService = new HookService(
                ProviderRegistry.of(provider),
                new TriggerUrlResolver("https://app.bitrise.io", override),
                new TriggerDispatcher(buildTriggerClient, 1),
                new OutcomeComposer());
        TriggerParams main = branch("main");
        when(provider.transform(request)).thenReturn(TransformResult.trigger(main));

        hookService.handle(params(), request);

        verify(buildTriggerClient).trigger(override, API_TOKEN, main);
    }
}

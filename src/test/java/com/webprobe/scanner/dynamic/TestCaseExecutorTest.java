package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.config.HttpClientFactory;
import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.models.TestOrigin;
import com.webprobe.scanner.support.LocalSite;
import com.webprobe.scanner.support.OneShotConnectionServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TestCaseExecutorTest {

    private LocalSite site;
    private final AtomicReference<String> postBody = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();
    private final AtomicReference<String> query = new AtomicReference<>();
    private TelemetryCollector telemetry;
    private TestCaseExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        site = LocalSite.start()
            .handler("/login", exchange -> {
                contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
                postBody.set(LocalSite.readBody(exchange));
                exchange.getResponseHeaders().add("X-Trace", "a");
                exchange.getResponseHeaders().add("X-Trace", "b");
                LocalSite.respond(exchange, 200, "ok", "text/plain");
            })
            .handler("/find", exchange -> {
                query.set(exchange.getRequestURI().getRawQuery());
                LocalSite.respond(exchange, 200, "found", "text/html");
            })
            .handler("/slow", exchange -> {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                LocalSite.respond(exchange, 200, "late", "text/plain");
            });
        telemetry = new TelemetryCollector();
        executor = new TestCaseExecutor(HttpClientFactory.create(5), "test_value", telemetry);
    }

    @AfterEach
    void tearDown() {
        if (site != null) {
            site.close();
        }
    }

    @Test
    void postFormSendsPayloadInTargetFieldAndPlaceholderElsewhere() {
        TestCase testCase = formCase("POST", site.url("/login"), "pass", "<script>");

        ResponseRecord response = executor.submit(testCase, Duration.ofSeconds(5));

        assertEquals(200, response.getStatusCode());
        assertEquals("ok", response.getBody());
        assertEquals("user=test_value&pass=%3Cscript%3E", postBody.get());
        assertTrue(contentType.get().startsWith("application/x-www-form-urlencoded"), contentType.get());
        assertEquals("a, b", response.header("x-trace"));
        assertEquals("a, b", response.getHeaders().get("X-TRACE"));
        assertEquals(site.url("/login"), response.getFinalUrl());
        assertTrue(response.getElapsedSeconds() >= 0.0);
    }

    @Test
    void getFormMergesFieldsIntoQuery() {
        TestCase testCase = formCase("GET", site.url("/find"), "pass", "x y");

        ResponseRecord response = executor.submit(testCase, Duration.ofSeconds(5));

        assertEquals(200, response.getStatusCode());
        assertEquals("user=test_value&pass=x%20y", query.get());
    }

    @Test
    void refusedConnectionBecomesStatusZero() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        TestCase testCase = paramCase("http://127.0.0.1:" + freePort + "/item?id=2");

        ResponseRecord response = executor.submit(testCase, Duration.ofSeconds(2));

        assertTrue(response.isFailure());
        assertEquals(0, response.getStatusCode());
        assertNotNull(response.getError());
        assertEquals("", response.getBody());
        assertEquals(1, telemetry.summarize().getNetworkErrors());
    }

    @Test
    void slowResponseTimesOut() {
        ResponseRecord response = executor.submit(paramCase(site.url("/slow")), Duration.ofMillis(300));

        assertEquals(0, response.getStatusCode());
        assertEquals("timeout", response.getError());
        assertEquals(1, telemetry.summarize().getTimeouts());
    }

    @Test
    void serverClosingEachConnectionDoesNotBreakSequentialRequests() throws Exception {
        try (OneShotConnectionServer server = OneShotConnectionServer.start()) {
            for (int i = 0; i < 6; i++) {
                ResponseRecord response = executor.submit(paramCase(server.url("/item?id=" + i)), Duration.ofSeconds(5));

                assertEquals(200, response.getStatusCode(), "request " + i + ": " + response.getError());
                assertEquals("ok", response.getBody());
            }
            assertTrue(server.connections() >= 6);
        }
        assertEquals(0, telemetry.summarize().getNetworkErrors());
    }

    @Test
    void malformedUrlIsReportedNotThrown() {
        ResponseRecord response = executor.submit(paramCase("not a url"), Duration.ofSeconds(1));

        assertTrue(response.isFailure());
        assertTrue(response.getError().startsWith("invalid url"), response.getError());
    }

    @Test
    void notFoundIsAResponseNotAFailure() {
        ResponseRecord response = executor.submit(paramCase(site.url("/missing?q=1")), Duration.ofSeconds(5));

        assertEquals(404, response.getStatusCode());
        assertFalse(response.isFailure());
        assertEquals(1, telemetry.summarize().getClientErrors());
    }

    private static TestCase formCase(String method, String url, String target, String value) {
        return TestCase.builder()
            .id("form-1")
            .method(method)
            .url(url)
            .targetParam(target)
            .injectedValue(value)
            .origin(TestOrigin.FORM)
            .category("xss")
            .formInputs(List.of("user", "pass"))
            .build();
    }

    private static TestCase paramCase(String url) {
        return TestCase.builder()
            .id("param-1")
            .method("GET")
            .url(url)
            .targetParam("id")
            .injectedValue("2")
            .origin(TestOrigin.PARAM)
            .category("idor_numeric")
            .build();
    }
}

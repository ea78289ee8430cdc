package com.webprobe.scanner.crawler;

import com.webprobe.scanner.config.HttpClientFactory;
import com.webprobe.scanner.support.LocalSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpPageFetcherTest {

    private LocalSite site;
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private final AtomicReference<String> accept = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        site = LocalSite.start()
            .handler("/home", exchange -> {
                userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
                accept.set(exchange.getRequestHeaders().getFirst("Accept"));
                LocalSite.respond(exchange, 200, "<h1>home</h1>", "text/html");
            })
            .redirect("/old", "/home")
            .handler("/broken", exchange -> LocalSite.respond(exchange, 500, "boom", "text/plain"));
    }

    @AfterEach
    void tearDown() {
        if (site != null) {
            site.close();
        }
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() throws Exception {
        FetchResult result = new OkHttpPageFetcher(2).fetch(site.url("/old"));

        assertEquals(200, result.getStatusCode());
        assertEquals(site.url("/home"), result.getFinalUrl());
        assertEquals("<h1>home</h1>", result.getBody());
        assertTrue(result.isPage());
        assertEquals(HttpClientFactory.USER_AGENT, userAgent.get());
        assertEquals(HttpClientFactory.ACCEPT, accept.get());
    }

    @Test
    void httpErrorStatusIsNotTransportFailure() throws Exception {
        FetchResult result = new OkHttpPageFetcher(2).fetch(site.url("/broken"));
        assertEquals(500, result.getStatusCode());
        assertEquals("boom", result.getBody());
    }

    @Test
    void refusedConnectionThrowsIOException() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        OkHttpPageFetcher fetcher = new OkHttpPageFetcher(2);
        assertThrows(IOException.class, () -> fetcher.fetch("http://127.0.0.1:" + freePort + "/"));
    }
}

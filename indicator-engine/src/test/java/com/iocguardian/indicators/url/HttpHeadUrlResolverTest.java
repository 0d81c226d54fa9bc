package com.iocguardian.indicators.url;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpHeadUrlResolverTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private HttpServer server;
    private String base;
    private SimpleMeterRegistry meterRegistry;
    private HttpHeadUrlResolver resolver;
    private final List<String> methods = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        server.createContext("/short", exchange -> {
            methods.add(exchange.getRequestMethod());
            exchange.getResponseHeaders().add("Location", "https://evil.com/landing");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/relative", exchange -> {
            methods.add(exchange.getRequestMethod());
            exchange.getResponseHeaders().add("Location", "/destination?id=7");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/plain", exchange -> {
            methods.add(exchange.getRequestMethod());
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();

        meterRegistry = new SimpleMeterRegistry();
        resolver = new HttpHeadUrlResolver(WebClient.builder(), Duration.ofMillis(500), meterRegistry);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void shouldReadLocationHeaderFromRedirect() {
        String resolved = resolver.unshorten(base + "/short").block(WAIT);

        assertEquals("https://evil.com/landing", resolved);
        assertEquals(List.of("HEAD"), methods);
        assertEquals(1.0, meterRegistry.counter("guardian.unshorten.requests").count());
    }

    @Test
    void shouldResolveRelativeLocationAgainstRequestUrl() {
        String resolved = resolver.unshorten(base + "/relative").block(WAIT);

        assertEquals(base + "/destination?id=7", resolved);
    }

    @Test
    void shouldReturnOriginalUrlWhenNotRedirected() {
        String url = base + "/plain";

        assertEquals(url, resolver.unshorten(url).block(WAIT));
    }

    @Test
    void shouldFailAfterTimeout() {
        assertThrows(RuntimeException.class, () -> resolver.unshorten(base + "/slow").block(WAIT));
        assertEquals(1.0, meterRegistry.counter("guardian.unshorten.failures").count());
    }

    @Test
    void shouldTrimSurroundingWhitespaceBeforeRequesting() {
        String resolved = resolver.unshorten(" " + base + "/short\n").block(WAIT);

        assertEquals("https://evil.com/landing", resolved);
        assertEquals(List.of("HEAD"), methods);
        assertEquals(0.0, meterRegistry.counter("guardian.unshorten.failures").count());
    }

    @Test
    void shouldReturnTrimmedUrlWhenNotRedirected() {
        String url = base + "/plain";

        assertEquals(url, resolver.unshorten(url + "\t").block(WAIT));
    }

    @Test
    void shouldFailForUnparsableUrl() {
        assertThrows(IllegalArgumentException.class, () -> resolver.unshorten("http://bad host/").block(WAIT));
        assertEquals(1.0, meterRegistry.counter("guardian.unshorten.failures").count());
        assertTrue(methods.isEmpty());
    }
}

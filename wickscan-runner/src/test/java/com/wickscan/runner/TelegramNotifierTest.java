package com.wickscan.runner;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramNotifierTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should post the message to every chat")
    void sendsToEveryChat() throws InterruptedException {
        // Given
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));
        server.enqueue(new MockResponse().setResponseCode(403));
        TelegramNotifier notifier = new TelegramNotifier(server.url("/").toString(), "TOKEN", List.of("111", "222"));

        // When
        notifier.send("<b>LONG BTCUSDT</b> opened");

        // Then
        RecordedRequest first = server.takeRequest(5, TimeUnit.SECONDS);
        RecordedRequest second = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals("/botTOKEN/sendMessage", first.getPath());
        assertEquals("POST", first.getMethod());
        assertEquals("Wickscan/1.0", first.getHeader("User-Agent"));
        String bodies = first.getBody().readUtf8() + "&" + second.getBody().readUtf8();
        assertTrue(bodies.contains("parse_mode=HTML"));
        assertTrue(bodies.contains("chat_id=111"));
        assertTrue(bodies.contains("chat_id=222"));
        notifier.close();
    }

    @Test
    @DisplayName("Should stay silent without a token or chats")
    void disabledWithoutCredentials() throws InterruptedException {
        TelegramNotifier noToken = new TelegramNotifier(server.url("/").toString(), "", List.of("111"));
        TelegramNotifier noChats = new TelegramNotifier(server.url("/").toString(), "TOKEN", null);

        noToken.send("hello");
        noChats.send("hello");

        assertFalse(noToken.isEnabled());
        assertFalse(noChats.isEnabled());
        assertNull(server.takeRequest(200, TimeUnit.MILLISECONDS));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("Should not throw when the API is unreachable")
    void unreachable() {
        TelegramNotifier notifier = new TelegramNotifier("http://localhost:1", "TOKEN", List.of("111"));

        assertDoesNotThrow(() -> notifier.send("hello"));
        notifier.close();
    }
}

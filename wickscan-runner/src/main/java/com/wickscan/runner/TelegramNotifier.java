package com.wickscan.runner;

import com.wickscan.execution.config.NotifierSettings;
import com.wickscan.execution.notify.Notifier;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Telegram bot sender - POSTs each message to every configured chat.
 */
public class TelegramNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final OkHttpClient client;
    private final String apiUrl;
    private final String token;
    private final List<String> chatIds;

    public TelegramNotifier(NotifierSettings settings) {
        this(settings.getTelegramApiUrl(), settings.getTelegramToken(), settings.getTelegramChatIds());
    }

    public TelegramNotifier(String apiUrl, String token, List<String> chatIds) {
        this.client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .build();
        this.apiUrl = stripSlash(apiUrl);
        this.token = token;
        this.chatIds = chatIds != null ? List.copyOf(chatIds) : List.of();
    }

    public boolean isEnabled() {
        return token != null && !token.isBlank() && !chatIds.isEmpty();
    }

    @Override
    public void send(String text) {
        if (!isEnabled() || text == null || text.isBlank()) {
            return;
        }
        for (String chatId : chatIds) {
            RequestBody body = new FormBody.Builder()
                .add("chat_id", chatId)
                .add("text", text)
                .add("parse_mode", "HTML")
                .add("disable_web_page_preview", "true")
                .build();

            Request request = new Request.Builder()
                .url(apiUrl + "/bot" + token + "/sendMessage")
                .post(body)
                .addHeader("User-Agent", "Wickscan/1.0")
                .build();

            client.newCall(request).enqueue(new Callback() {
                @Override
                public void onFailure(Call call, IOException e) {
                    log.warn("Telegram send to {} failed: {}", chatId, e.getMessage());
                }

                @Override
                public void onResponse(Call call, Response response) {
                    if (response.isSuccessful()) {
                        log.debug("Telegram sent to {} -> {}", chatId, response.code());
                    } else {
                        log.warn("Telegram error for {} -> {}", chatId, response.code());
                    }
                    response.close();
                }
            });
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static String stripSlash(String url) {
        if (url == null || url.isBlank()) {
            return "https://api.telegram.org";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NotifierSettings {

    private boolean telegramEnabled;
    private String telegramToken;
    private List<String> telegramChatIds = List.of();
    private String telegramApiUrl = "https://api.telegram.org";

    public boolean isTelegramEnabled() { return telegramEnabled; }
    public void setTelegramEnabled(boolean v) { this.telegramEnabled = v; }

    public String getTelegramToken() { return telegramToken; }
    public void setTelegramToken(String telegramToken) { this.telegramToken = telegramToken; }

    public List<String> getTelegramChatIds() { return telegramChatIds; }
    public void setTelegramChatIds(List<String> v) { this.telegramChatIds = v; }

    public String getTelegramApiUrl() { return telegramApiUrl; }
    public void setTelegramApiUrl(String telegramApiUrl) { this.telegramApiUrl = telegramApiUrl; }
}

package com.aicmd.cache.translation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.translation")
public class TranslationProperties {
    static final String DEFAULT_SYSTEM_PROMPT =
        "You are a helpful assistant that provides shell commands based on a user's natural language prompt. "
            + "Only provide the shell command itself, with no additional explanation, formatting, or markdown "
            + "code blocks. Do not wrap the command in backticks, code fences, or any other formatting. "
            + "Return only the raw command text. For any parameters that require user input, enclose them in "
            + "angle brackets, like so: <parameter_name>.";

    private String baseUrl = "https://openrouter.ai/api";
    private String apiKey;
    private String model;
    private int timeoutMs = 30000;
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}

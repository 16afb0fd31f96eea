package com.aicmd.cache.translation;

public interface TranslationClient {
    String translate(String query);
}

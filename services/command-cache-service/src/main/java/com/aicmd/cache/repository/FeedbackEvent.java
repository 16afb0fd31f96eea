package com.aicmd.cache.repository;

import java.time.Instant;

public record FeedbackEvent(long id, String queryHash, String command, FeedbackAction action, Instant timestamp) {}

package com.aicmd.cache.decision;

import com.aicmd.cache.interaction.CommandSource;
import com.aicmd.cache.interaction.ConfirmationResult;
import com.aicmd.cache.safety.SafetyVerdict;

public record CommandResult(
    String command,
    CommandSource source,
    DecisionAction action,
    ConfirmationResult confirmation,
    boolean accepted,
    double confidence,
    Double similarity,
    SafetyVerdict safety
) {}

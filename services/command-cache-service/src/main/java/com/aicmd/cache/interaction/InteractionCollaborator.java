package com.aicmd.cache.interaction;

public interface InteractionCollaborator {
    ConfirmationResult confirm(String command, CommandSource source, double confidence, Double similarity);
}

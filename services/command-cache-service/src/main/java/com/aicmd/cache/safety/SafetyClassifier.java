package com.aicmd.cache.safety;

public interface SafetyClassifier {
    SafetyVerdict classify(String command);

    default boolean isDangerous(String command) {
        return classify(command).dangerous();
    }
}

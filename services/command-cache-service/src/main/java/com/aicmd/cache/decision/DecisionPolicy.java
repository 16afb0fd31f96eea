package com.aicmd.cache.decision;

import com.aicmd.cache.matching.MatchingProperties;
import org.springframework.stereotype.Component;

@Component
public class DecisionPolicy {
    private final double confidenceThreshold;
    private final double autoCopyThreshold;
    private final double similarityThreshold;

    public DecisionPolicy(DecisionProperties decisionProperties, MatchingProperties matchingProperties) {
        decisionProperties.validate();
        matchingProperties.validate();
        this.confidenceThreshold = decisionProperties.getConfidenceThreshold();
        this.autoCopyThreshold = decisionProperties.getAutoCopyThreshold();
        this.similarityThreshold = matchingProperties.getSimilarityThreshold();
    }

    public DecisionAction forExact(double confidence, boolean dangerous) {
        if (confidence >= autoCopyThreshold) {
            return dangerous ? DecisionAction.CONFIRM : DecisionAction.AUTO_USE;
        }
        if (confidence >= confidenceThreshold) {
            return DecisionAction.CONFIRM;
        }
        return DecisionAction.TRANSLATE;
    }

    public DecisionAction forSimilar(double similarity) {
        return similarity >= similarityThreshold ? DecisionAction.CONFIRM : DecisionAction.TRANSLATE;
    }
}

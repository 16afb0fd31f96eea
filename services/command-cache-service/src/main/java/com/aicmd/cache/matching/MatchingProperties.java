package com.aicmd.cache.matching;

import com.aicmd.cache.config.Checks;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.matching")
public class MatchingProperties {
    private double similarityThreshold = 0.7;
    private double jaccardWeight = 0.5;
    private boolean removeStopWords = true;
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getJaccardWeight() {
        return jaccardWeight;
    }

    public void setJaccardWeight(double jaccardWeight) {
        this.jaccardWeight = jaccardWeight;
    }

    public boolean isRemoveStopWords() {
        return removeStopWords;
    }

    public void setRemoveStopWords(boolean removeStopWords) {
        this.removeStopWords = removeStopWords;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms;
    }

    public void validate() {
        Checks.requireUnitInterval("aicmd.matching.similarity-threshold", similarityThreshold);
        Checks.requireUnitInterval("aicmd.matching.jaccard-weight", jaccardWeight);
    }
}

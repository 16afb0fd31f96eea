package com.aicmd.cache.matching;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class QueryMatcher {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern PATH = Pattern.compile("[/~][\\w/.-]*|[\\w.-]+\\.\\w+");
    private static final Pattern PORT = Pattern.compile(":(\\d{2,5})\\b");
    private static final Pattern IP = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
    private static final Pattern FLAG = Pattern.compile("(?<![\\w-])-+[\\w-]+");

    private final SynonymTable synonyms;
    private final double jaccardWeight;

    @Autowired
    public QueryMatcher(MatchingProperties properties) {
        this(synonymTable(properties), properties.getJaccardWeight());
    }

    public QueryMatcher(SynonymTable synonyms, double jaccardWeight) {
        if (jaccardWeight < 0.0 || jaccardWeight > 1.0) {
            throw new IllegalArgumentException("jaccardWeight must be within [0, 1]");
        }
        this.synonyms = synonyms;
        this.jaccardWeight = jaccardWeight;
    }

    public NormalizedQuery normalize(String query) {
        String lowered = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(lowered);
        while (matcher.find()) {
            String token = matcher.group();
            if (synonyms.isStopWord(token)) {
                continue;
            }
            tokens.add(synonyms.canonicalize(token));
        }
        if (tokens.isEmpty()) {
            return new NormalizedQuery(tokens, WHITESPACE.matcher(lowered.trim()).replaceAll(" "));
        }
        return new NormalizedQuery(tokens, String.join(" ", tokens));
    }

    public String hash(String query) {
        return hash(normalize(query));
    }

    public String hash(NormalizedQuery normalized) {
        return QueryHashes.shortSha256(normalized.hashKey());
    }

    public double similarity(String first, String second) {
        return similarity(normalize(first), normalize(second));
    }

    public double similarity(NormalizedQuery first, NormalizedQuery second) {
        if (first.isEmpty() && second.isEmpty()) {
            return first.canonical().equals(second.canonical()) ? 1.0 : 0.0;
        }
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        double jaccard = jaccard(first.tokenSet(), second.tokenSet());
        double sequence = sequenceRatio(first.canonical(), second.canonical());
        double score = jaccardWeight * jaccard + (1.0 - jaccardWeight) * sequence;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public void addSynonyms(String canonical, Collection<String> aliases) {
        synonyms.addSynonyms(canonical, aliases);
    }

    public Map<String, List<String>> extractParameters(String query) {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return parameters;
        }
        collect(parameters, "paths", PATH.matcher(query), 0);
        collect(parameters, "ports", PORT.matcher(query), 1);
        collect(parameters, "ips", IP.matcher(query), 0);
        collect(parameters, "flags", FLAG.matcher(query), 0);
        return parameters;
    }

    static boolean isSingleToken(String word) {
        return TOKEN.matcher(word).matches();
    }

    static double jaccard(Set<String> first, Set<String> second) {
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        return (double) intersection.size() / union.size();
    }

    static double sequenceRatio(String first, String second) {
        int total = first.length() + second.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(first, second) / total;
    }

    static int longestCommonSubsequence(String first, String second) {
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int i = 1; i <= first.length(); i++) {
            char c = first.charAt(i - 1);
            for (int j = 1; j <= second.length(); j++) {
                if (c == second.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }

    private static void collect(Map<String, List<String>> target, String key, Matcher matcher, int group) {
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.add(matcher.group(group));
        }
        if (!values.isEmpty()) {
            target.put(key, values);
        }
    }

    private static SynonymTable synonymTable(MatchingProperties properties) {
        properties.validate();
        return new SynonymTable(properties.getSynonyms(), properties.isRemoveStopWords());
    }
}

package com.aicmd.cache.matching;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class SynonymTable {
    static final Map<String, List<String>> DEFAULT_GROUPS = defaultGroups();

    static final Set<String> DEFAULT_STOP_WORDS = Set.of(
        "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
        "have", "has", "had", "do", "does", "did", "will", "would", "could",
        "should", "may", "might", "can", "must", "shall", "to", "of", "in",
        "on", "at", "by", "for", "with", "from", "up", "about", "into",
        "through", "during", "before", "after", "above", "below", "between",
        "among", "under", "over", "out", "off", "down", "so", "but", "and",
        "or", "not", "no", "nor", "as", "if", "than", "then", "now", "here",
        "there", "when", "where", "why", "how", "what", "which", "who",
        "whom", "this", "that", "these", "those", "my", "your", "his",
        "her", "its", "our", "their"
    );

    private final Map<String, List<String>> groups = new LinkedHashMap<>();
    private final Set<String> stopWords;
    private volatile Map<String, String> canonicalByWord;

    public SynonymTable(Map<String, List<String>> extraGroups, boolean removeStopWords) {
        this.stopWords = removeStopWords ? DEFAULT_STOP_WORDS : Set.of();
        for (Map.Entry<String, List<String>> group : DEFAULT_GROUPS.entrySet()) {
            merge(groups, group.getKey(), group.getValue());
        }
        if (extraGroups != null) {
            for (Map.Entry<String, List<String>> group : extraGroups.entrySet()) {
                merge(groups, group.getKey(), group.getValue());
            }
        }
        this.canonicalByWord = buildIndex(groups, stopWords);
    }

    public static SynonymTable defaults() {
        return new SynonymTable(Map.of(), true);
    }

    public boolean isStopWord(String token) {
        return stopWords.contains(token);
    }

    public String canonicalize(String token) {
        String canonical = canonicalByWord.get(token);
        return canonical == null ? token : canonical;
    }

    public synchronized void addSynonyms(String canonical, Collection<String> aliases) {
        Map<String, List<String>> updated = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            updated.put(group.getKey(), new ArrayList<>(group.getValue()));
        }
        merge(updated, canonical, aliases);
        Map<String, String> index = buildIndex(updated, stopWords);
        groups.clear();
        groups.putAll(updated);
        canonicalByWord = index;
    }

    private static void merge(Map<String, List<String>> target, String canonical, Collection<String> aliases) {
        String key = clean(canonical);
        if (key == null) {
            throw new IllegalStateException("synonym group needs a canonical word");
        }
        List<String> list = target.computeIfAbsent(key, ignored -> new ArrayList<>());
        if (aliases == null) {
            return;
        }
        for (String alias : aliases) {
            String cleaned = clean(alias);
            if (cleaned != null && !cleaned.equals(key) && !list.contains(cleaned)) {
                list.add(cleaned);
            }
        }
    }

    private static Map<String, String> buildIndex(Map<String, List<String>> groups, Set<String> stopWords) {
        Map<String, String> index = new HashMap<>();
        for (String canonical : groups.keySet()) {
            if (stopWords.contains(canonical)) {
                throw new IllegalStateException("canonical word is a stop word: " + canonical);
            }
            index.put(canonical, canonical);
        }
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            for (String alias : group.getValue()) {
                if (groups.containsKey(alias)) {
                    throw new IllegalStateException(
                        "alias '" + alias + "' of '" + group.getKey() + "' is itself a canonical word"
                    );
                }
                String previous = index.putIfAbsent(alias, group.getKey());
                if (previous != null && !previous.equals(group.getKey())) {
                    throw new IllegalStateException(
                        "alias '" + alias + "' maps to both '" + previous + "' and '" + group.getKey() + "'"
                    );
                }
            }
        }
        return Map.copyOf(index);
    }

    private static String clean(String word) {
        if (word == null) {
            return null;
        }
        String value = word.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return null;
        }
        if (!QueryMatcher.isSingleToken(value)) {
            throw new IllegalStateException("synonym must be a single word: '" + word + "'");
        }
        return value;
    }

    private static Map<String, List<String>> defaultGroups() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        // file operations
        groups.put("list", List.of("show", "display", "ls", "dir", "列出", "显示", "查看"));
        groups.put("create", List.of("make", "new", "mkdir", "touch", "创建", "新建"));
        groups.put("delete", List.of("remove", "rm", "del", "unlink", "删除", "移除"));
        groups.put("copy", List.of("cp", "duplicate", "复制", "拷贝"));
        groups.put("move", List.of("mv", "rename", "移动", "重命名"));
        groups.put("find", List.of("search", "locate", "grep", "查找", "搜索"));
        // system
        groups.put("install", List.of("add", "setup", "安装", "添加"));
        groups.put("update", List.of("upgrade", "refresh", "更新", "升级"));
        groups.put("start", List.of("run", "execute", "launch", "启动", "运行"));
        groups.put("stop", List.of("kill", "terminate", "halt", "停止", "终止"));
        groups.put("status", List.of("check", "info", "state", "状态", "检查"));
        // network
        groups.put("download", List.of("fetch", "get", "pull", "下载", "获取"));
        groups.put("upload", List.of("push", "send", "上传", "发送"));
        groups.put("connect", List.of("link", "join", "连接", "链接"));
        // modifiers
        groups.put("all", List.of("everything", "total", "全部", "所有"));
        groups.put("current", List.of("present", "当前", "现在"));
        groups.put("recursive", List.of("r", "deep", "递归", "深度"));
        groups.put("force", List.of("f", "overwrite", "强制", "覆盖"));
        return groups;
    }
}

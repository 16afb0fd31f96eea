package com.aicmd.cache.cache;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public record PlatformInfo(String osType, String shellType) {

    public static PlatformInfo detect() {
        return detect(System.getProperty("os.name", ""), System.getenv());
    }

    static PlatformInfo detect(String osName, Map<String, String> env) {
        String os = osType(osName);
        return new PlatformInfo(os, shellType(os, env));
    }

    private static String osType(String osName) {
        String name = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return "windows";
        }
        if (name.contains("mac") || name.contains("darwin")) {
            return "macos";
        }
        if (name.contains("linux")) {
            return "linux";
        }
        return name.isBlank() ? "unknown" : name.replace(' ', '_');
    }

    private static String shellType(String os, Map<String, String> env) {
        String shell = env.get("SHELL");
        if (shell != null && !shell.isBlank()) {
            Path fileName = Path.of(shell.trim()).getFileName();
            return fileName == null ? shell.trim() : fileName.toString();
        }
        if ("windows".equals(os)) {
            if (env.containsKey("PSModulePath")) {
                return "powershell";
            }
            return "cmd";
        }
        return "sh";
    }
}

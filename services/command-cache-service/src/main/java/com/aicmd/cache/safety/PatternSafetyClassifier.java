package com.aicmd.cache.safety;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PatternSafetyClassifier implements SafetyClassifier {
    private static final Logger log = LoggerFactory.getLogger(PatternSafetyClassifier.class);

    private static final List<String> DEFAULT_PATTERNS = List.of(
        // deletes
        "\\brm\\s+.*-r.*/",
        "\\brm\\s+.*-f.*/",
        "\\brm\\s+-[rf]+\\s+/",
        "\\brm\\s+-[rf]+\\s+\\*",
        "\\brmdir\\s+.*/",
        "\\bsudo\\s+rm\\s+.*-[rf]",
        // disks and devices
        "\\bdd\\s+.*of=/dev/",
        "\\bmkfs\\.",
        "\\bformat\\s+[a-zA-Z]:",
        "\\bdel\\s+.*\\*",
        // permissions
        "\\bchmod\\s+777",
        "\\bchown\\s+.*:.*\\s+/",
        ">\\s*/dev/",
        "\\bmv\\s+.*\\s+/dev/null",
        // processes and power
        "\\bkill\\s+-9\\s+1\\b",
        "\\bkillall\\s+.*",
        "\\bshutdown\\s+.*",
        "\\breboot\\b",
        "\\bhalt\\b",
        // package managers
        "\\bapt\\s+.*remove.*--purge.*\\*",
        "\\byum\\s+.*remove.*\\*",
        "\\bpip\\s+.*uninstall.*-y.*\\*"
    );

    private static final List<Pattern> CRITICAL = compileAll(List.of(
        "\\brm\\s+-[rf]+\\s+/",
        "\\bdd\\s+.*of=/dev/",
        "\\bformat\\s+[a-zA-Z]:",
        "\\bmkfs\\.",
        "\\bkill\\s+-9\\s+1\\b",
        "\\bshutdown\\s+.*",
        "\\breboot\\b",
        "\\bhalt\\b"
    ));

    private static final List<Pattern> DANGEROUS = compileAll(List.of(
        "\\brm\\s+.*-[rf]",
        "\\bchmod\\s+777",
        "\\bkillall\\s+.*",
        "\\bsudo\\s+rm\\s+.*"
    ));

    private final List<Pattern> patterns;

    public PatternSafetyClassifier(SafetyProperties properties) {
        List<Pattern> compiled = new ArrayList<>(compileAll(DEFAULT_PATTERNS));
        for (String extra : properties.getExtraPatterns()) {
            try {
                compiled.add(Pattern.compile(extra, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException ex) {
                log.warn("ignoring invalid safety pattern pattern={} error={}", extra, ex.getDescription());
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    @Override
    public SafetyVerdict classify(String command) {
        if (command == null || command.isBlank() || !matchesAny(patterns, command)) {
            return SafetyVerdict.safe();
        }
        if (matchesAny(CRITICAL, command)) {
            return new SafetyVerdict(Severity.CRITICAL, List.of(
                "CRITICAL: this command could cause irreversible system damage",
                "it may delete system files or damage your system"
            ));
        }
        if (matchesAny(DANGEROUS, command)) {
            return new SafetyVerdict(Severity.DANGEROUS, List.of(
                "WARNING: this command could delete files or modify system settings"
            ));
        }
        return new SafetyVerdict(Severity.WARNING, List.of("CAUTION: this command requires careful consideration"));
    }

    private static boolean matchesAny(List<Pattern> candidates, String command) {
        for (Pattern pattern : candidates) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return compiled;
    }
}

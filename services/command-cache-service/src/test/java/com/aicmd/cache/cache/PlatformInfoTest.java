package com.aicmd.cache.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PlatformInfoTest {

    @Test
    void shellComesFromEnvironment() {
        PlatformInfo info = PlatformInfo.detect("Linux", Map.of("SHELL", "/usr/bin/zsh"));

        assertThat(info).isEqualTo(new PlatformInfo("linux", "zsh"));
    }

    @Test
    void macAndWindowsAreRecognised() {
        assertThat(PlatformInfo.detect("Mac OS X", Map.of()).osType()).isEqualTo("macos");
        assertThat(PlatformInfo.detect("Windows 11", Map.of("PSModulePath", "C:\\ps")))
            .isEqualTo(new PlatformInfo("windows", "powershell"));
        assertThat(PlatformInfo.detect("Windows 10", Map.of()).shellType()).isEqualTo("cmd");
    }

    @Test
    void unknownSystemFallsBackToSh() {
        assertThat(PlatformInfo.detect("", Map.of())).isEqualTo(new PlatformInfo("unknown", "sh"));
    }
}

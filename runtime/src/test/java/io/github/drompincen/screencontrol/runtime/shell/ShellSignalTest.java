package io.github.drompincen.screencontrol.runtime.shell;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShellSignalTest {

    @Test
    void parseAcceptsCommonSpellings() {
        assertThat(ShellSignal.parse(null)).contains(ShellSignal.TERM);
        assertThat(ShellSignal.parse("")).contains(ShellSignal.TERM);
        assertThat(ShellSignal.parse("kill")).contains(ShellSignal.KILL);
        assertThat(ShellSignal.parse("SIGINT")).contains(ShellSignal.INT);
        assertThat(ShellSignal.parse(" usr2 ")).contains(ShellSignal.USR2);
        assertThat(ShellSignal.parse("STOP")).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void interruptGoesThroughKillCommand() throws Exception {
        Process process = new ProcessBuilder("sleep", "30").start();
        try {
            ShellSignal.INT.deliver(process);

            assertThat(process.waitFor(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            process.destroyForcibly();
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failedKillReportsItsOutput() throws Exception {
        Process process = new ProcessBuilder("true").start();
        process.waitFor();

        assertThatThrownBy(() -> ShellSignal.HUP.deliver(process))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("kill -s HUP failed: ")
                .hasMessageNotContaining("\uFFFD");
    }
}

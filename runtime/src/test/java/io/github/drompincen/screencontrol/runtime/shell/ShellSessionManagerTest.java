package io.github.drompincen.screencontrol.runtime.shell;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellSessionManagerTest {

    @TempDir
    Path tempDir;

    private ShellSessionManager manager;

    @BeforeEach
    void setUp() {
        manager = new ShellSessionManager(new ShellSettings(30, 1024, 3, 2000, tempDir));
    }

    @AfterEach
    void tearDown() {
        manager.cleanupAll();
    }

    @Test
    void runCapturesStdoutAndExitCode() {
        ExecResult result = manager.run("echo hi", null, 5, true);

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).contains("hi");
        assertThat(result.truncated()).isFalse();
        assertThat(result.timedOut()).isFalse();
    }

    @Test
    void runReportsNonZeroExitAndStderr() {
        ExecResult result = manager.run("echo oops >&2; exit 3", null, 5, true);

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).contains("oops");
    }

    @Test
    void runDiscardsStderrWhenNotCaptured() {
        ExecResult result = manager.run("echo oops >&2", null, 5, false);

        assertThat(result.stderr()).isEmpty();
    }

    @Test
    void runUsesGivenWorkingDirectory() {
        ExecResult result = manager.run("pwd", tempDir.toString(), 5, true);

        assertThat(Path.of(result.stdout().trim()).toAbsolutePath().normalize().toString())
                .endsWith(tempDir.getFileName().toString());
    }

    @Test
    void runTimesOutAndKills() {
        long start = System.currentTimeMillis();

        ExecResult result = manager.run("echo before; sleep 10", null, 1, true);

        assertThat(System.currentTimeMillis() - start).isLessThan(6000);
        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(result.stdout()).contains("before");
    }

    @Test
    void runTruncatesOutputBeyondCap() {
        ExecResult result = manager.run("head -c 5000 /dev/zero | tr '\\0' 'a'", null, 5, true);

        assertThat(result.truncated()).isTrue();
        assertThat(result.stdout()).hasSize(1024);
    }

    @Test
    void runRejectsMissingWorkingDirectory() {
        assertThatThrownBy(() -> manager.run("true", tempDir.resolve("missing").toString(), 5, true))
                .isInstanceOf(ShellSessionException.class)
                .hasMessageContaining("Working directory does not exist");
    }

    @Test
    void sessionLifecycle() throws Exception {
        SessionStart start = manager.start("cat", null, Map.of(), true);

        assertThat(start.sessionId()).startsWith("session_");
        assertThat(start.pid()).isPositive();
        assertThat(manager.listAll()).extracting(SessionSnapshot::sessionId).contains(start.sessionId());

        assertThat(manager.sendInput(start.sessionId(), "hello\n")).isEqualTo(6);
        waitForOutput(start.sessionId(), "hello");

        StopResult stop = manager.stop(start.sessionId(), null);
        assertThat(stop.exited()).isTrue();
        assertThat(stop.signal()).isEqualTo(ShellSignal.TERM);

        assertThat(manager.listAll()).extracting(SessionSnapshot::sessionId).doesNotContain(start.sessionId());
        assertThat(manager.describe(start.sessionId())).isEmpty();
        assertThatThrownBy(() -> manager.sendInput(start.sessionId(), "again\n"))
                .isInstanceOf(ShellSessionException.class)
                .hasMessage("Session " + start.sessionId() + " not found");
        assertThatThrownBy(() -> manager.stop(start.sessionId(), "TERM"))
                .hasMessageContaining("not found");
    }

    @Test
    void describeShowsRunningSession() {
        SessionStart start = manager.start("sleep 30", null, null, true);

        assertThat(manager.describe(start.sessionId())).hasValueSatisfying(s -> {
            assertThat(s.state()).isEqualTo(SessionState.RUNNING);
            assertThat(s.command()).isEqualTo("sleep 30");
            assertThat(s.pid()).isEqualTo(start.pid());
            assertThat(s.exitCode()).isNull();
        });
    }

    @Test
    void exitedSessionKeepsExitCodeUntilFinalRead() throws Exception {
        SessionStart start = manager.start("echo done; exit 3", null, null, true);
        awaitState(start.sessionId(), SessionState.EXITED);

        assertThat(manager.describe(start.sessionId())).hasValueSatisfying(s -> assertThat(s.exitCode()).isEqualTo(3));
        assertThat(manager.listAll()).extracting(SessionSnapshot::sessionId).contains(start.sessionId());
        assertThatThrownBy(() -> manager.sendInput(start.sessionId(), "late\n"))
                .hasMessage("Session " + start.sessionId() + " is not running");

        SessionOutput last = manager.readOutput(start.sessionId());
        assertThat(last.state()).isEqualTo(SessionState.EXITED);
        assertThat(last.exitCode()).isEqualTo(3);
        assertThat(last.stdout()).contains("done");

        assertThat(manager.describe(start.sessionId())).isEmpty();
        assertThatThrownBy(() -> manager.readOutput(start.sessionId()))
                .hasMessage("Session " + start.sessionId() + " not found");
    }

    @Test
    void stoppingAnExitedSessionReleasesIt() throws Exception {
        SessionStart start = manager.start("exit 0", null, null, true);
        awaitState(start.sessionId(), SessionState.EXITED);

        StopResult stop = manager.stop(start.sessionId(), "TERM");

        assertThat(stop.exited()).isTrue();
        assertThat(manager.describe(start.sessionId())).isEmpty();
    }

    @Test
    void exitedSessionsDoNotCountAgainstCeiling() throws Exception {
        for (int i = 0; i < 3; i++) {
            awaitState(manager.start("exit 0", null, null, true).sessionId(), SessionState.EXITED);
        }

        SessionStart fourth = manager.start("sleep 30", null, null, true);

        assertThat(manager.listAll()).hasSize(4);
        assertThat(manager.describe(fourth.sessionId())).isPresent();
    }

    @Test
    void inputToChildThatNeverReadsDoesNotBlockCaller() {
        SessionStart start = manager.start("sleep 30", null, null, true);
        String large = "x".repeat(1_000_000);

        long begin = System.currentTimeMillis();
        assertThat(manager.sendInput(start.sessionId(), large)).isEqualTo(1_000_000);
        assertThat(manager.sendInput(start.sessionId(), "more\n")).isEqualTo(5);
        assertThat(System.currentTimeMillis() - begin).isLessThan(4000);

        assertThat(manager.describe(start.sessionId())).hasValueSatisfying(
                s -> assertThat(s.state()).isEqualTo(SessionState.RUNNING));
        assertThat(manager.stop(start.sessionId(), "KILL").exited()).isTrue();
    }

    @Test
    void inputIsRefusedWhileStopIsPending() throws Exception {
        ShellSessionManager slow = new ShellSessionManager(new ShellSettings(30, 1024, 3, 1500, tempDir));
        SessionStart start = slow.start("trap '' TERM; echo ready; sleep 30", null, null, true);
        try {
            waitForOutput(slow, start.sessionId(), "ready");

            CompletableFuture<StopResult> stop = CompletableFuture.supplyAsync(() -> slow.stop(start.sessionId(), "TERM"));
            Thread.sleep(200);

            assertThat(stop).isNotDone();
            assertThatThrownBy(() -> slow.sendInput(start.sessionId(), "x"))
                    .isInstanceOf(ShellSessionException.class)
                    .hasMessage("Session " + start.sessionId() + " is not running");
            assertThat(slow.describe(start.sessionId())).hasValueSatisfying(s -> {
                assertThat(s.state()).isEqualTo(SessionState.RUNNING);
                assertThat(s.exitCode()).isNull();
            });

            StopResult result = stop.get(5, TimeUnit.SECONDS);
            assertThat(result.exited()).isFalse();
            assertThat(slow.describe(start.sessionId())).isEmpty();
        } finally {
            ProcessHandle.of(start.pid()).ifPresent(p -> {
                p.descendants().forEach(ProcessHandle::destroyForcibly);
                p.destroyForcibly();
            });
            slow.cleanupAll();
        }
    }

    @Test
    void environmentIsPassedToSession() throws Exception {
        SessionStart start = manager.start("echo $GREETING; cat", null, Map.of("GREETING", "bonjour"), true);

        waitForOutput(start.sessionId(), "bonjour");
    }

    @Test
    void concurrentSessionsGetDistinctIdsAndSeparateOutput() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<SessionStart> a = () -> manager.start("echo alpha; cat", null, null, true);
            Callable<SessionStart> b = () -> manager.start("echo beta; cat", null, null, true);
            Future<SessionStart> fa = pool.submit(a);
            Future<SessionStart> fb = pool.submit(b);
            SessionStart sa = fa.get();
            SessionStart sb = fb.get();

            assertThat(sa.sessionId()).isNotEqualTo(sb.sessionId());
            String outA = waitForOutput(sa.sessionId(), "alpha");
            String outB = waitForOutput(sb.sessionId(), "beta");
            assertThat(outA).doesNotContain("beta");
            assertThat(outB).doesNotContain("alpha");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void sessionCeilingIsEnforced() {
        manager.start("sleep 30", null, null, true);
        manager.start("sleep 30", null, null, true);
        manager.start("sleep 30", null, null, true);

        assertThatThrownBy(() -> manager.start("sleep 30", null, null, true))
                .isInstanceOf(ShellSessionException.class)
                .hasMessage("Maximum concurrent sessions (3) reached");
    }

    @Test
    void unsupportedSignalIsRejected() {
        SessionStart start = manager.start("sleep 30", null, null, true);

        assertThatThrownBy(() -> manager.stop(start.sessionId(), "BOGUS"))
                .isInstanceOf(ShellSessionException.class)
                .hasMessage("Unsupported signal: BOGUS");
        assertThat(manager.describe(start.sessionId())).isPresent();
    }

    @Test
    void killSignalStopsSession() {
        SessionStart start = manager.start("sleep 30", null, null, true);

        StopResult stop = manager.stop(start.sessionId(), "SIGKILL");

        assertThat(stop.signal()).isEqualTo(ShellSignal.KILL);
        assertThat(stop.exited()).isTrue();
    }

    @Test
    void cleanupAllTerminatesSessionsAndRefusesNewWork() {
        manager.start("sleep 30", null, null, true);
        manager.start("sleep 30", null, null, true);

        manager.cleanupAll();

        assertThat(manager.listAll()).isEmpty();
        assertThatThrownBy(() -> manager.start("sleep 1", null, null, true))
                .isInstanceOf(ShellSessionException.class);
    }

    private void awaitState(String sessionId, SessionState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (manager.describe(sessionId).map(SessionSnapshot::state).orElse(null) == expected) {
                return;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Session " + sessionId + " never reached " + expected);
    }

    private String waitForOutput(String sessionId, String expected) throws InterruptedException {
        return waitForOutput(manager, sessionId, expected);
    }

    private static String waitForOutput(ShellSessionManager manager, String sessionId, String expected)
            throws InterruptedException {
        StringBuilder seen = new StringBuilder();
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            seen.append(manager.readOutput(sessionId).stdout());
            if (seen.toString().contains(expected)) {
                return seen.toString();
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Output of " + sessionId + " never contained '" + expected + "': " + seen);
    }
}

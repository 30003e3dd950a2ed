package io.github.drompincen.screencontrol.runtime.shell;

/** {@code exited} is false when the process was still alive once the stop grace period ran out. */
public record StopResult(String sessionId, ShellSignal signal, boolean exited) {
}

package io.github.drompincen.screencontrol.runtime.shell;

public record SessionStart(String sessionId, long pid) {
}

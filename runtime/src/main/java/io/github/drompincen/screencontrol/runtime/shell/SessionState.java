package io.github.drompincen.screencontrol.runtime.shell;

public enum SessionState {
    STARTING,
    RUNNING,
    /** Process ended on its own. Terminal. */
    EXITED,
    /** Process ended after a caller asked it to stop. Terminal. */
    STOPPED;

    public String wireName() {
        return name().toLowerCase();
    }
}

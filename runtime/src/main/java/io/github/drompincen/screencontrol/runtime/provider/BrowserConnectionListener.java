package io.github.drompincen.screencontrol.runtime.provider;

@FunctionalInterface
public interface BrowserConnectionListener {

    void connectionChanged(boolean connected);
}

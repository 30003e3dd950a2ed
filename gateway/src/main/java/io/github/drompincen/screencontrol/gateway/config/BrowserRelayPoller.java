package io.github.drompincen.screencontrol.gateway.config;

import io.github.drompincen.screencontrol.tools.HttpBrowserRelay;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Keeps the relay's connected flag current so tool advertisement follows the browser bridge. */
@Component
public class BrowserRelayPoller {

    private final HttpBrowserRelay relay;

    public BrowserRelayPoller(HttpBrowserRelay relay) {
        this.relay = relay;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${screencontrol.browser.poll-interval-ms:2000}")
    public void poll() {
        relay.refreshConnectionState();
    }
}

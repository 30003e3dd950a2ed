package io.github.drompincen.screencontrol.gateway;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.runtime.shell.ShellSessionManager;
import io.github.drompincen.screencontrol.runtime.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "screencontrol.http.port=0",
        "screencontrol.http.api-key=context-test-key",
        "screencontrol.browser.poll-interval-ms=600000",
        "screencontrol.shell.max-sessions=4",
        "screencontrol.tools.disabled-tools=wait"
})
class ScreenControlApplicationTest {

    @Autowired
    private ScreenControlLauncher launcher;

    @Autowired
    private ToolRegistry registry;

    @Autowired
    private ShellSessionManager sessionManager;

    @Test
    void startsListenerOnLoopback() throws Exception {
        assertThat(launcher.httpPort()).isPositive();

        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + launcher.httpPort() + "/shell/sessions"))
                        .header("Authorization", "Bearer context-test-key")
                        .POST(HttpRequest.BodyPublishers.ofString("{}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"sessions\"");
    }

    @Test
    void appliesConfiguration() {
        assertThat(sessionManager.settings().maxSessions()).isEqualTo(4);
        assertThat(registry.describe("wait")).isEmpty();
        assertThat(registry.describe("screenshot")).isPresent();
        assertThat(registry.definitionsFor(EnumSet.allOf(ToolCategory.class)))
                .anyMatch(def -> def.category() == ToolCategory.BROWSER);
    }
}

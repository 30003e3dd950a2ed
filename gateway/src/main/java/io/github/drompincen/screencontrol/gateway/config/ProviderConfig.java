package io.github.drompincen.screencontrol.gateway.config;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.runtime.shell.ShellSessionManager;
import io.github.drompincen.screencontrol.runtime.shell.ShellSettings;
import io.github.drompincen.screencontrol.runtime.tools.ToolSettings;
import io.github.drompincen.screencontrol.tools.AutomationToolProvider;
import io.github.drompincen.screencontrol.tools.BrowserToolProvider;
import io.github.drompincen.screencontrol.tools.FilesystemToolProvider;
import io.github.drompincen.screencontrol.tools.HttpBrowserRelay;
import io.github.drompincen.screencontrol.tools.LocalFilesystemProvider;
import io.github.drompincen.screencontrol.tools.PathResolver;
import io.github.drompincen.screencontrol.tools.RobotAutomationProvider;
import io.github.drompincen.screencontrol.tools.ShellToolProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/** Wires the tool providers from {@link ScreenControlProperties}. */
@Configuration
public class ProviderConfig {

    @Bean
    ToolSettings toolSettings(ScreenControlProperties properties) {
        Set<ToolCategory> categories = EnumSet.noneOf(ToolCategory.class);
        for (String id : properties.getTools().getDisabledCategories()) {
            categories.add(ToolCategory.fromId(id.trim())
                    .orElseThrow(() -> new IllegalStateException("Unknown tool category: " + id)));
        }
        return new ToolSettings(categories, properties.getTools().getDisabledTools());
    }

    @Bean
    ShellSettings shellSettings(ScreenControlProperties properties) {
        ScreenControlProperties.Shell shell = properties.getShell();
        return new ShellSettings(
                shell.getDefaultTimeoutSeconds(),
                shell.getMaxOutputBytes(),
                shell.getMaxSessions(),
                shell.getStopGraceMs(),
                workingDirectory(shell));
    }

    @Bean
    PathResolver pathResolver(ShellSettings shellSettings) {
        return new PathResolver(shellSettings.workingDirectory());
    }

    @Bean
    HttpBrowserRelay browserRelay(ScreenControlProperties properties) {
        ScreenControlProperties.Browser browser = properties.getBrowser();
        return new HttpBrowserRelay(URI.create(browser.getBridgeUrl()), browser.getTimeoutSeconds());
    }

    @Bean
    FilesystemToolProvider filesystemToolProvider(PathResolver pathResolver) {
        return new FilesystemToolProvider(new LocalFilesystemProvider(pathResolver));
    }

    @Bean
    ShellToolProvider shellToolProvider(ShellSessionManager sessionManager) {
        return new ShellToolProvider(sessionManager);
    }

    @Bean
    BrowserToolProvider browserToolProvider(HttpBrowserRelay browserRelay) {
        return new BrowserToolProvider(browserRelay);
    }

    @Bean
    AutomationToolProvider automationToolProvider() {
        return new AutomationToolProvider(new RobotAutomationProvider());
    }

    private static Path workingDirectory(ScreenControlProperties.Shell shell) {
        String dir = shell.getWorkingDirectory();
        return dir == null || dir.isBlank() ? null : Path.of(dir).toAbsolutePath().normalize();
    }
}

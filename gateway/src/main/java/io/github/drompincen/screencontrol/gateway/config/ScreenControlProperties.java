package io.github.drompincen.screencontrol.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

@ConfigurationProperties(prefix = "screencontrol")
public class ScreenControlProperties {

    private final Http http = new Http();
    private final Mcp mcp = new Mcp();
    private final Shell shell = new Shell();
    private final Browser browser = new Browser();
    private final Tools tools = new Tools();

    public Http getHttp() { return http; }
    public Mcp getMcp() { return mcp; }
    public Shell getShell() { return shell; }
    public Browser getBrowser() { return browser; }
    public Tools getTools() { return tools; }

    public static class Http {
        private boolean enabled = true;
        private int port = 3456;
        /** Bearer key. Generated at startup when left empty. */
        private String apiKey = "";
        private int maxRequestBytes = 1024 * 1024;
        private int receiveTimeoutMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public int getMaxRequestBytes() { return maxRequestBytes; }
        public void setMaxRequestBytes(int maxRequestBytes) { this.maxRequestBytes = maxRequestBytes; }
        public int getReceiveTimeoutMs() { return receiveTimeoutMs; }
        public void setReceiveTimeoutMs(int receiveTimeoutMs) { this.receiveTimeoutMs = receiveTimeoutMs; }
    }

    public static class Mcp {
        private boolean stdio;
        private String serverName = "screencontrol";
        private String serverVersion = "1.0.0";
        private String protocolVersion = "2024-11-05";

        public boolean isStdio() { return stdio; }
        public void setStdio(boolean stdio) { this.stdio = stdio; }
        public String getServerName() { return serverName; }
        public void setServerName(String serverName) { this.serverName = serverName; }
        public String getServerVersion() { return serverVersion; }
        public void setServerVersion(String serverVersion) { this.serverVersion = serverVersion; }
        public String getProtocolVersion() { return protocolVersion; }
        public void setProtocolVersion(String protocolVersion) { this.protocolVersion = protocolVersion; }
    }

    public static class Shell {
        private int defaultTimeoutSeconds = 600;
        private int maxOutputBytes = 128 * 1024;
        private int maxSessions = 10;
        private long stopGraceMs = 2000;
        private String workingDirectory;

        public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
        public int getMaxOutputBytes() { return maxOutputBytes; }
        public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
        public long getStopGraceMs() { return stopGraceMs; }
        public void setStopGraceMs(long stopGraceMs) { this.stopGraceMs = stopGraceMs; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    }

    public static class Browser {
        private String bridgeUrl = "http://127.0.0.1:3457";
        private int timeoutSeconds = 30;
        private long pollIntervalMs = 2000;

        public String getBridgeUrl() { return bridgeUrl; }
        public void setBridgeUrl(String bridgeUrl) { this.bridgeUrl = bridgeUrl; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    public static class Tools {
        private Set<String> disabledCategories = new LinkedHashSet<>();
        private Set<String> disabledTools = new LinkedHashSet<>();

        public Set<String> getDisabledCategories() { return disabledCategories; }
        public void setDisabledCategories(Set<String> disabledCategories) { this.disabledCategories = disabledCategories; }
        public Set<String> getDisabledTools() { return disabledTools; }
        public void setDisabledTools(Set<String> disabledTools) { this.disabledTools = disabledTools; }
    }
}

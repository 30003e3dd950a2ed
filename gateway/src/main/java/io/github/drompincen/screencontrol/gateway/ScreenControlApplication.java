package io.github.drompincen.screencontrol.gateway;

import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.screencontrol")
@ConfigurationPropertiesScan
@EnableScheduling
public class ScreenControlApplication {

    public static void main(String[] args) {
        // stdout carries MCP frames, so nothing else may print there
        new SpringApplicationBuilder(ScreenControlApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .run(args);
    }
}

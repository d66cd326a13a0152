package com.controlplane;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class ControlPlaneApplication {

    public static void main(String[] args) {
        // No web server; the non-daemon session-timer threads keep the process up until shutdown.
        new SpringApplicationBuilder(ControlPlaneApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off")
                .run(args);
    }
}

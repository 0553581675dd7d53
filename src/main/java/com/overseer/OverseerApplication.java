package com.overseer;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class OverseerApplication {

    public static void main(String[] args) {
        // Embedded engine: no web server, the host drives the Overseer bean directly.
        new SpringApplicationBuilder(OverseerApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}

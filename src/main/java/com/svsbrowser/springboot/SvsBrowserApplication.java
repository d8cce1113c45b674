package com.svsbrowser.springboot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

@SpringBootApplication
@EnableScheduling
public class SvsBrowserApplication {

    public static void main(String[] args) {
        boolean commandMode = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--command="));
        SpringApplication application = new SpringApplication(SvsBrowserApplication.class);
        if (!commandMode) {
            application.run(args);
            return;
        }
        // one-shot command: no web server, exit with the command's status
        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}

package com.foodintel.catalog;

import com.foodintel.catalog.cli.PipelineCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Runs as a service (REST trigger + schedule) by default, or as a one-shot
 * command when started with {@code --category} or {@code --run}.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CatalogPipelineApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CatalogPipelineApplication.class);
        boolean cli = PipelineCommandLineRunner.isCliInvocation(args);
        if (cli) {
            app.setWebApplicationType(WebApplicationType.NONE);
            // the context stays open until the runner's own hook has recorded a cancelled run
            app.setRegisterShutdownHook(false);
        }

        ConfigurableApplicationContext context = app.run(args);
        if (cli) {
            System.exit(SpringApplication.exit(context));
        }
    }
}

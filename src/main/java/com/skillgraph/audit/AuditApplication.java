package com.skillgraph.audit;

import com.skillgraph.audit.cli.AuditCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Runs one audit and exits when a registry location is given on the command line,
 * otherwise serves the audit over HTTP.
 */
@SpringBootApplication
public class AuditApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(AuditApplication.class);
        boolean batch = AuditCommand.hasRegistryLocation(args);
        if (batch) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);
        if (batch) {
            System.exit(SpringApplication.exit(context));
        }
    }
}

package com.warden;

import com.warden.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Entry point for both the orchestrator server ({@code warden serve}) and the
 * in-sandbox entrypoints ({@code warden worker}, {@code warden claude-bridge}).
 * <p>
 * The DataSource is only built when {@code warden.store.type=jdbc}, see
 * {@link com.warden.core.persistence.StoreConfig}.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class WardenApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeInvocation(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(WardenApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // worker, claude-bridge and status run without a web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}

package com.streamfirst.shush.boot;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Entry point: parses the command line, then starts a non-web Spring context holding
 * the configured Sensu adapters and runs the command inside it.
 */
@SpringBootApplication
public class ShushApplication {

    public static void main(String[] args) {
        System.exit(run(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true)));
    }

    static int run(String[] args, PrintWriter out, PrintWriter err) {
        ShushCommand command = new ShushCommand();
        CommandLine cli = new CommandLine(command).setOut(out).setErr(err);
        try {
            cli.parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            err.println("error: " + e.getMessage());
            e.getCommandLine().usage(err);
            return ShushCommandRunner.EXIT_USAGE;
        }
        if (cli.isUsageHelpRequested()) {
            cli.usage(out);
            return ShushCommandRunner.EXIT_OK;
        }
        if (cli.isVersionHelpRequested()) {
            cli.printVersionHelp(out);
            return ShushCommandRunner.EXIT_OK;
        }

        SpringApplication application = new SpringApplication(ShushApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);
        application.setLogStartupInfo(false);

        ConfigurableApplicationContext context;
        try {
            context = application.run(command.springArguments().toArray(String[]::new));
        } catch (RuntimeException e) {
            err.println("error: configuration problem: " + rootMessage(e));
            return ShushCommandRunner.EXIT_USAGE;
        }
        try (context) {
            return context.getBean(ShushCommandRunner.class).run(command, out, err);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.toString();
    }
}

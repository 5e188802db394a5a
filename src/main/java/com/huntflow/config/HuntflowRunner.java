package com.huntflow.config;

import com.huntflow.HuntflowException;
import com.huntflow.display.Display;
import com.huntflow.session.HuntSession;
import com.huntflow.session.HuntSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs the huntflow files given on the command line in one session and prints their displays
 */
@Component
@ConditionalOnProperty(name = "huntflow.runner.enabled", havingValue = "true", matchIfMissing = true)
public class HuntflowRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(HuntflowRunner.class);

    private final HuntSessionFactory sessionFactory;

    public HuntflowRunner(HuntSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            log.info("No huntflow files given");
            return;
        }
        try (HuntSession session = sessionFactory.create()) {
            for (String arg : args) {
                Path file = Paths.get(arg);
                log.info("Executing huntflow {}", file);
                for (Display display : session.execute(read(file))) {
                    System.out.println(display.render());
                }
            }
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            log.error("Failed to read huntflow {}: {}", file, e.getMessage());
            throw new HuntflowException("cannot read huntflow " + file, e);
        }
    }
}

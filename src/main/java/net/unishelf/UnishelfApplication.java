package net.unishelf;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the resource discovery service.
 */
@SpringBootApplication
public class UnishelfApplication {

    private static final Logger log = LoggerFactory.getLogger(UnishelfApplication.class);

    public static void main(String[] args) {
        // Load .env file first so provider keys are visible to property resolution
        loadDotEnvFile();
        disableNettyUnsafeAccess();
        SpringApplication.run(UnishelfApplication.class, args);
    }

    private static void disableNettyUnsafeAccess() {
        if (System.getProperty("io.netty.noUnsafe") == null) {
            System.setProperty("io.netty.noUnsafe", "true");
        }
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (Files.exists(envFile)) {
                Properties props = new Properties();
                try (InputStream is = Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Real environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
                log.info("Loaded {} entr(ies) from .env", props.size());
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}

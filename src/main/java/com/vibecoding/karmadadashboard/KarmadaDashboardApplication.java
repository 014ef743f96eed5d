package com.vibecoding.karmadadashboard;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KarmadaDashboardApplication {

    private static final Logger log = LoggerFactory.getLogger(KarmadaDashboardApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  Karmada Dashboard API");
        log.info("==============================================");

        loadDotenv();

        SpringApplication.run(KarmadaDashboardApplication.class, args);
    }

    /**
     * .env 값을 시스템 프로퍼티로 올린다. 실제 환경 변수가 우선
     */
    static void loadDotenv() {
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            int loaded = 0;
            for (var entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                if (System.getenv(entry.getKey()) != null || System.getProperty(entry.getKey()) != null) {
                    log.debug("Keeping existing value for {}", entry.getKey());
                    continue;
                }
                System.setProperty(entry.getKey(), entry.getValue());
                loaded++;
            }
            log.info("Loaded {} variables from .env", loaded);
        } catch (DotenvException e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }
    }
}

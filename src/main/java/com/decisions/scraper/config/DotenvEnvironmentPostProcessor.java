package com.decisions.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file and adds its entries as a high-priority property source,
 * so deployments can set e.g. `SCRAPER_PORTAL_URL` or
 * `SCRAPER_TARGET_RESULTS_PER_KEYWORD` without touching application.yml.
 * <p>
 * The file is looked up in the working directory unless `dotenv.directory`
 * points elsewhere. A missing file is ignored.
 * </p>
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    static final String DIRECTORY_PROPERTY = "dotenv.directory";

    /** highest precedence so .env entries override everything else */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty(DIRECTORY_PROPERTY, "."))
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        // entries() without a filter would also copy the whole process environment
        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));
        if (map.isEmpty()) {
            return;
        }

        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}

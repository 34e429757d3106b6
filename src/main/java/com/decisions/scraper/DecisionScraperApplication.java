package com.decisions.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Decision Scraper application.
 *
 * <p>This Spring Boot application exposes one RESTful endpoint,
 * <code>POST /api/search</code>, which searches a court-decision portal for a
 * set of keywords in parallel and returns the de-duplicated decisions found,
 * serving repeated keyword sets from an in-memory cache.</p>
 *
 * <p>The browser integration is plugged in as a
 * {@link com.decisions.scraper.driver.PageDriverFactory} bean.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/decision-scraper-0.1.0-SNAPSHOT.jar
 * }</pre>
 */
@SpringBootApplication
public class DecisionScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(DecisionScraperApplication.class, args);
    }
}

package co.fanki.specsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spec Sync Server Application.
 *
 * <p>Entry point for the Spec Sync Server, which mirrors the feature
 * documents of registered projects (specifications, task lists, data
 * models, plans and research notes) into a relational store and keeps
 * that mirror current while the files change on disk.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class SpecSyncServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(SpecSyncServerApplication.class, args);
    }

}

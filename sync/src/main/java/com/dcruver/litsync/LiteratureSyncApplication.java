package com.dcruver.litsync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Literature Sync.
 *
 * Keeps a Markdown vault organized like a Zotero library and generates one
 * literature note per paper: PDF text extraction, an LLM summary and a rendered
 * Markdown document. Vault changes are previewed by default, backed up before
 * they are applied, and nothing is ever deleted outright.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class LiteratureSyncApplication {

    public static void main(String[] args) {
        log.info("Starting Literature Sync...");
        SpringApplication.run(LiteratureSyncApplication.class, args);
    }
}

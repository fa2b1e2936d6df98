package com.dcruver.litsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the literature sync, bound from the {@code litsync.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "litsync")
public class SyncProperties {

    /**
     * Root of the Markdown vault notes are written into.
     */
    private String vaultPath = "${user.home}/Obsidian/Literature";

    /**
     * Holds done.txt, checkpoint.json, the summary cache, audit logs and the vault lock.
     */
    private String stateDir = "${user.home}/.litsync";

    /**
     * Snapshot ZIPs are written here; kept outside the vault so they are not synced.
     */
    private String backupDir = "${user.home}/.litsync/backups";

    private String archiveFolder = "_archived";

    private String imageFolder = "img";

    /**
     * Zotero data directory containing zotero.sqlite and storage/.
     */
    private String zoteroDataDir = "${user.home}/Zotero";

    private List<String> itemTypes = new ArrayList<>(List.of("journalArticle", "preprint", "conferencePaper"));

    private int workers = 5;

    private int checkpointInterval = 10;

    private Duration cacheFreshness = Duration.ofDays(7);

    private Retry retry = new Retry();

    private Summarizer summarizer = new Summarizer();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        private int transientRetries = 2;
        private Duration transientDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Summarizer {
        private String language = "English";
        private int maxTextLength = 12000;
        private int maxImages = 5;
    }

    public Path vaultDir() {
        return expand(vaultPath);
    }

    public Path stateDirPath() {
        return expand(stateDir);
    }

    public Path backupDirPath() {
        return expand(backupDir);
    }

    public Path zoteroDir() {
        return expand(zoteroDataDir);
    }

    static Path expand(String path) {
        String expanded = path.replace("${user.home}", System.getProperty("user.home"));
        if (expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        return Paths.get(expanded).toAbsolutePath().normalize();
    }
}

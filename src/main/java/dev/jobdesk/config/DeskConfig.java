package dev.jobdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the person running this desk and for document routing.
 * Loaded from application.yml under 'desk' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "desk")
public class DeskConfig {

    /**
     * Identity used for lock ownership, note authorship and temp file names.
     */
    private String user = System.getProperty("user.name", "unknown");

    /**
     * Display name matched against project owners.
     */
    private String displayName = "";

    /**
     * Users who see every job on the dashboard instead of only their own.
     */
    private List<String> supervisors = new ArrayList<>();

    /**
     * File extension of finished drawing documents.
     */
    private String documentExtension = ".pdf";

    /**
     * Root of the per-job folders that finished documents are moved into.
     */
    private Path issuedDocumentsRoot;

    /**
     * Folders searched for a job's workspace when its recorded one is missing
     * on this machine.
     */
    private List<Path> workspaceRoots = new ArrayList<>();

    private Notify notify = new Notify();

    @Data
    public static class Notify {
        private boolean mail = false;
        private String from = "";
        private List<String> to = new ArrayList<>();
    }
}

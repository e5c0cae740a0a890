package com.arbiter.core.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "arbiter.workspace")
public class WorkspaceProperties {

    /** Directory scanned for context. */
    private String root = ".";

    /** Maximum number of matching files returned. */
    private int maxFiles = 20;

    /** Characters of each matching file kept as a preview. */
    private int previewLength = 500;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public void setPreviewLength(int previewLength) {
        this.previewLength = previewLength;
    }
}

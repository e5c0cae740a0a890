package com.arbiter.core.value;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "arbiter.memory")
public class MemoryProperties {

    private boolean persistent = true;
    private String file = ".arbiter/global_value_memory.json";
    private int historyLimit = 100;
    private int driftLimit = 50;

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public int getDriftLimit() {
        return driftLimit;
    }

    public void setDriftLimit(int driftLimit) {
        this.driftLimit = driftLimit;
    }
}

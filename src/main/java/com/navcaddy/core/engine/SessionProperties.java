package com.navcaddy.core.engine;

import com.navcaddy.core.model.SessionContext;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "navcaddy.session")
public class SessionProperties {

    /** Conversation turns kept per session, at most {@link SessionContext#MAX_HISTORY_SIZE}. */
    private int maxHistory = SessionContext.MAX_HISTORY_SIZE;

    /** Threads running conversation turns. */
    private int workerThreads = 4;

    /** Threads blocked on language model calls. */
    private int modelThreads = 8;

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getModelThreads() {
        return modelThreads;
    }

    public void setModelThreads(int modelThreads) {
        this.modelThreads = modelThreads;
    }
}

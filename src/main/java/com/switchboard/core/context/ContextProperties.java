package com.switchboard.core.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchboard.context")
public class ContextProperties {

    /** Most exemplars ever served to the classifier, whatever the caller asks for. */
    private int retention = 20;

    /** Exemplars served when the caller gives no limit. */
    private int defaultLimit = 10;

    public int getRetention() {
        return retention;
    }

    public void setRetention(int retention) {
        this.retention = retention;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }
}

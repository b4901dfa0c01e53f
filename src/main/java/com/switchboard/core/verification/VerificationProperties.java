package com.switchboard.core.verification;

import com.switchboard.core.model.VerificationLayer;
import com.switchboard.core.model.VerificationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchboard.verification")
public class VerificationProperties {

    private VerificationMode mode = VerificationMode.STRICT;

    /** Lenient mode approves when the weights of passing stages add up to at least this. */
    private double minPassWeight = 3.0;

    /** Per-layer weight for lenient aggregation; missing layers weigh 1. */
    private Map<VerificationLayer, Double> weights = new EnumMap<>(VerificationLayer.class);

    private Syntax syntax = new Syntax();
    private Safety safety = new Safety();
    private Intent intent = new Intent();

    public VerificationMode getMode() {
        return mode;
    }

    public void setMode(VerificationMode mode) {
        this.mode = mode;
    }

    public double getMinPassWeight() {
        return minPassWeight;
    }

    public void setMinPassWeight(double minPassWeight) {
        this.minPassWeight = minPassWeight;
    }

    public Map<VerificationLayer, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<VerificationLayer, Double> weights) {
        this.weights = weights;
    }

    public double weightOf(VerificationLayer layer) {
        return weights.getOrDefault(layer, 1.0);
    }

    public Syntax getSyntax() {
        return syntax;
    }

    public void setSyntax(Syntax syntax) {
        this.syntax = syntax;
    }

    public Safety getSafety() {
        return safety;
    }

    public void setSafety(Safety safety) {
        this.safety = safety;
    }

    public Intent getIntent() {
        return intent;
    }

    public void setIntent(Intent intent) {
        this.intent = intent;
    }

    public static class Syntax {
        private int maxCommandLength = 4096;

        public int getMaxCommandLength() {
            return maxCommandLength;
        }

        public void setMaxCommandLength(int maxCommandLength) {
            this.maxCommandLength = maxCommandLength;
        }
    }

    public static class Safety {
        /** Regular expressions, matched case-insensitively anywhere in a command. */
        private List<String> blockedPatterns = new ArrayList<>(List.of(
                "\\brm\\s+-[a-z]*r[a-z]*\\s+(-\\S+\\s+)*(/|/\\*|~/?|\\$HOME)(\\s|;|$)",
                "\\bmkfs(\\.\\w+)?\\b",
                "\\bdd\\b.*\\bof=/dev/",
                ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*}\\s*;\\s*:",
                "\\b(shutdown|reboot|halt|poweroff)\\b",
                "\\bchmod\\s+-[a-z]*r[a-z]*\\s+777\\s+/(\\s|$)",
                "\\b(curl|wget)\\b[^|]*\\|\\s*(sudo\\s+)?(ba|z|da)?sh\\b",
                ">\\s*/dev/sd[a-z]"));

        /** Writes and deletes at or below these paths are refused. */
        private List<String> protectedPaths = new ArrayList<>(List.of(
                "/etc", "/boot", "/usr", "/bin", "/sbin", "~/.ssh"));

        private boolean allowIrreversible = false;

        public List<String> getBlockedPatterns() {
            return blockedPatterns;
        }

        public void setBlockedPatterns(List<String> blockedPatterns) {
            this.blockedPatterns = blockedPatterns;
        }

        public List<String> getProtectedPaths() {
            return protectedPaths;
        }

        public void setProtectedPaths(List<String> protectedPaths) {
            this.protectedPaths = protectedPaths;
        }

        public boolean isAllowIrreversible() {
            return allowIrreversible;
        }

        public void setAllowIrreversible(boolean allowIrreversible) {
            this.allowIrreversible = allowIrreversible;
        }
    }

    public static class Intent {
        /** Per-call timeout; falls back to {@code switchboard.llm.timeout} when unset. */
        private Duration timeout;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}

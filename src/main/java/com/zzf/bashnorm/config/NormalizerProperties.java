package com.zzf.bashnorm.config;

import com.zzf.bashnorm.lexicon.GrammarProfileLoader;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bashnorm")
public class NormalizerProperties {
    private String profileLocation = GrammarProfileLoader.DEFAULT_LOCATION;
    private boolean normalizeDigits = true;
    /**
     * Overrides the profile's nesting bound when positive.
     */
    private int maxDepth = 0;

    public String getProfileLocation() {
        return profileLocation;
    }

    public void setProfileLocation(String profileLocation) {
        this.profileLocation = profileLocation;
    }

    public boolean isNormalizeDigits() {
        return normalizeDigits;
    }

    public void setNormalizeDigits(boolean normalizeDigits) {
        this.normalizeDigits = normalizeDigits;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
}

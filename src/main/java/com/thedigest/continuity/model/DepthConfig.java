package com.thedigest.continuity.model;

/**
 * Static per-depth limits. Every field grows (or stays equal) from shallow to deep.
 */
public record DepthConfig(
        int highlightLimit,
        int citationLimit,
        int maxTokens,
        int maxSourceArticles,
        int changedBulletLimit,
        int watchNextLimit
) {

    /**
     * @return true when every limit of this config is at most the matching limit of {@code other}
     */
    public boolean isAtMost(DepthConfig other) {
        return highlightLimit <= other.highlightLimit
                && citationLimit <= other.citationLimit
                && maxTokens <= other.maxTokens
                && maxSourceArticles <= other.maxSourceArticles
                && changedBulletLimit <= other.changedBulletLimit
                && watchNextLimit <= other.watchNextLimit;
    }
}

package com.gardenalert.common.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RarityTierTest {

    @Test
    void tiersAreOrderedByNotificationPriority() {
        assertThat(RarityTier.values()).containsExactly(
                RarityTier.COMMON,
                RarityTier.UNCOMMON,
                RarityTier.RARE,
                RarityTier.LEGENDARY,
                RarityTier.MYTHICAL,
                RarityTier.DIVINE,
                RarityTier.PRISMATIC);
        assertThat(RarityTier.UNCOMMON.isAbove(RarityTier.COMMON)).isTrue();
        assertThat(RarityTier.COMMON.isAbove(RarityTier.COMMON)).isFalse();
    }

    @Test
    void fromLabel_isCaseInsensitive() {
        assertThat(RarityTier.fromLabel("legendary")).contains(RarityTier.LEGENDARY);
        assertThat(RarityTier.fromLabel(" Mythical ")).contains(RarityTier.MYTHICAL);
    }

    @Test
    void fromLabel_acceptsUpstreamSpellingOfDivine() {
        assertThat(RarityTier.fromLabel("Devine")).contains(RarityTier.DIVINE);
    }

    @Test
    void fromLabel_unknownOrBlank_isEmpty() {
        assertThat(RarityTier.fromLabel("Super")).isEmpty();
        assertThat(RarityTier.fromLabel("")).isEmpty();
        assertThat(RarityTier.fromLabel(null)).isEmpty();
    }
}

package com.gardenalert.relay.infrastructure.rarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.gardenalert.common.model.RarityTier;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class RarityClassificationLoaderTest {

    private final RarityClassificationLoader loader = new RarityClassificationLoader(new DefaultResourceLoader());

    @Test
    void shouldLoadTableSkippingCommentsAndBadLines() {
        // when
        var table = loader.load("classpath:rarity/classification-sample.csv");

        // then
        assertThat(table).containsOnly(
                entry("Carrot", RarityTier.COMMON),
                entry("Tomato", RarityTier.RARE),
                entry("Grape", RarityTier.DIVINE));
    }

    @Test
    void shouldLoadBundledTable() {
        // when
        var table = loader.load("classpath:rarity-classification.csv");

        // then
        assertThat(table).containsEntry("Carrot", RarityTier.COMMON);
        assertThat(table).hasSizeGreaterThan(20);
    }

    @Test
    void shouldFailWhenTableIsMissing() {
        assertThatThrownBy(() -> loader.load("classpath:rarity/missing.csv"))
                .isInstanceOf(UncheckedIOException.class);
    }
}

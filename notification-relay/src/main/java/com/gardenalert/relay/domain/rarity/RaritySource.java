package com.gardenalert.relay.domain.rarity;

public enum RaritySource {
    OVERRIDE,
    UPSTREAM,
    CLASSIFICATION_TABLE,
    DEFAULT
}

package com.dockerlab.model;

import java.time.OffsetDateTime;

/**
 * What the store reports about itself: its clock and its product/version string.
 */
public record StoreProbe(OffsetDateTime currentTime, String version) {}

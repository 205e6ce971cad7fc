package com.dockerlab.model;

public record StoreCounts(long users, long products, long totalStock) {}

package com.portfoliotracker.common.model;

public enum Freshness {
    FRESH,
    STALE
}

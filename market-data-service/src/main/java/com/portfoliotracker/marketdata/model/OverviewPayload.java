package com.portfoliotracker.marketdata.model;

import com.portfoliotracker.common.model.CompanyOverview;

public record OverviewPayload(String raw, CompanyOverview overview) {}

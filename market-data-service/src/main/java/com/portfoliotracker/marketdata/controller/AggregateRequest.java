package com.portfoliotracker.marketdata.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfoliotracker.common.model.PositionRequest;

import java.util.List;

/**
 * Either {@code positions} or the parallel {@code symbols}/{@code shares} lists.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregateRequest(
    @JsonProperty("positions") List<PositionRequest> positions,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("shares") List<Integer> shares
) {}

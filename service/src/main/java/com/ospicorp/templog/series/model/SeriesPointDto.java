package com.ospicorp.templog.series.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"timestamp", "temperature"})
public record SeriesPointDto(String timestamp, double temperature) {}

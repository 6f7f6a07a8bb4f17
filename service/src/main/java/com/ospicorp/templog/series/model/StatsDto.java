package com.ospicorp.templog.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatsDto(
    double min,
    double max,
    double avg,
    int count,
    String start,
    String end,
    @JsonProperty("time_col") String timeColumn,
    @JsonProperty("temp_col") String temperatureColumn
) {}

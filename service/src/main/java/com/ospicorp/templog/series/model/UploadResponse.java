package com.ospicorp.templog.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record UploadResponse(
    @JsonProperty("time_key") String timeKey,
    @JsonProperty("temp_key") String temperatureKey,
    List<SeriesPointDto> data,
    List<SeriesPointDto> hourly,
    StatsDto stats
) {}

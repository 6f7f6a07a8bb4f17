package com.ospicorp.templog.series.model;

import java.util.List;

public record UploadResult(
    UploadResponse response,
    List<SeriesPointDto> points,
    List<SeriesPointDto> hourlyPoints
) {}

package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.AssembledSeries;
import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.RawTable;
import com.ospicorp.templog.series.model.SeriesPointDto;
import com.ospicorp.templog.series.model.StatsDto;
import com.ospicorp.templog.series.model.SummaryStats;
import com.ospicorp.templog.series.model.TemperatureSelection;
import com.ospicorp.templog.series.model.TimeDetection;
import com.ospicorp.templog.series.model.TimeRange;
import com.ospicorp.templog.series.model.TimeSeriesPoint;
import com.ospicorp.templog.series.model.UploadResponse;
import com.ospicorp.templog.series.model.UploadResult;
import com.ospicorp.templog.series.reader.TabularFileReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TemperatureUploadService {
  private static final Logger log = LoggerFactory.getLogger(TemperatureUploadService.class);

  static final String TIME_KEY = "timestamp";
  static final String TEMP_KEY = "temperature";
  // seconds always, fraction only when non-zero
  static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  private final TabularFileReader fileReader;

  public TemperatureUploadService(TabularFileReader fileReader) {
    this.fileReader = fileReader;
  }

  public UploadResult process(byte[] content, String filename, TimeRange range) {
    RawTable raw = fileReader.read(content, filename);
    return process(raw, filename, range);
  }

  public UploadResult process(RawTable raw, String filename, TimeRange range) {
    NormalizedTable table = TableNormalizer.normalize(raw);

    TimeDetection time = DatetimeColumnDetector.detect(table);
    TemperatureSelection selection = TemperatureColumnSelector.select(table);

    AssembledSeries series = SeriesAssembler.assemble(table, time, selection, range);
    SummaryStats stats = StatisticsSummarizer.summarize(series);
    List<TimeSeriesPoint> hourly = Resampler.resample(series.points(), Resampler.HOURLY);

    log.info("Processed '{}': {} rows, time '{}' (score {}), temperature '{}' -> {} points, {} hourly",
        filename, table.rowCount(), series.timeColumn(), time.score(),
        series.temperatureColumn(), stats.count(), hourly.size());

    List<SeriesPointDto> points = toDtos(series.points());
    List<SeriesPointDto> hourlyPoints = toDtos(hourly);
    UploadResponse response = new UploadResponse(TIME_KEY, TEMP_KEY, points, hourlyPoints,
        toDto(stats));
    return new UploadResult(response, points, hourlyPoints);
  }

  private static StatsDto toDto(SummaryStats stats) {
    return new StatsDto(
        stats.min(),
        stats.max(),
        stats.mean(),
        stats.count(),
        format(stats.start()),
        format(stats.end()),
        stats.timeColumn(),
        stats.temperatureColumn());
  }

  private static List<SeriesPointDto> toDtos(List<TimeSeriesPoint> points) {
    List<SeriesPointDto> out = new ArrayList<>(points.size());
    for (TimeSeriesPoint p : points) {
      out.add(new SeriesPointDto(format(p.timestamp()), p.temperature()));
    }
    return out;
  }

  static String format(LocalDateTime timestamp) {
    return timestamp.format(TIMESTAMP_FORMAT);
  }
}

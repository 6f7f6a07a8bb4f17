package com.ospicorp.templog.series.controller;

import com.ospicorp.templog.series.exception.InvalidParameterException;
import com.ospicorp.templog.series.model.Resolution;
import com.ospicorp.templog.series.model.TimeRange;
import com.ospicorp.templog.series.model.UploadResponse;
import com.ospicorp.templog.series.model.UploadResult;
import com.ospicorp.templog.series.service.DateTimeParser;
import com.ospicorp.templog.series.service.TemperatureUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@Validated
@RequestMapping("/api")
@Tag(name = "Upload")
public class UploadController {
  private static final String ERROR_DOCS_BASE = "https://docs.templog.dev/errors/";
  private static final String RESOLUTION_REGEX = "(?i)raw|hourly";

  private final TemperatureUploadService uploadService;

  public UploadController(TemperatureUploadService uploadService) {
    this.uploadService = uploadService;
  }

  @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Upload a temperature log",
      description = "Detects the time and temperature columns of a CSV/XLS/XLSX export and "
          + "returns the cleaned series, an hourly average and summary statistics.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Series and statistics",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = UploadResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unreadable file or no usable series",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "413", description = "File too large",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> upload(
      @RequestParam("file") @Parameter(description = "Logger export (.csv, .xls, .xlsx)") MultipartFile file,
      @RequestParam(required = false)
          @Parameter(description = "Keep readings at or after this instant", example = "2024-02-01T10:00") String start,
      @RequestParam(required = false)
          @Parameter(description = "Keep readings at or before this instant", example = "01/02/2024 18:00") String end,
      @RequestParam(name = "format", required = false) @Parameter(description = "json or csv") String format,
      @RequestParam(defaultValue = "raw") @Pattern(regexp = RESOLUTION_REGEX) @Parameter(description = "CSV rows: raw or hourly") String resolution,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) throws IOException {

    TimeRange range = parseRange(start, end);
    Resolution csvResolution = parseResolution(resolution);
    MediaType contentType = selectMediaType(format, accept);

    UploadResult result = uploadService.process(file.getBytes(), file.getOriginalFilename(), range);

    Object body;
    if (contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
      body = csvResolution == Resolution.HOURLY ? result.hourlyPoints() : result.points();
    } else {
      body = result.response();
    }
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static TimeRange parseRange(String start, String end) {
    LocalDateTime from = parseBound(start, "start", 1001);
    LocalDateTime to = parseBound(end, "end", 1002);
    if (from != null && to != null && from.isAfter(to)) {
      throw invalidParameter("Invalid range. start must be before or equal to end.", 1003);
    }
    return new TimeRange(from, to);
  }

  private static LocalDateTime parseBound(String value, String name, int errorCode) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    LocalDateTime parsed = DateTimeParser.parseDateTime(value);
    if (parsed == null) {
      throw invalidParameter("Invalid " + name + " value. Use an ISO-8601 or dd/MM/yyyy [HH:mm] date.",
          errorCode);
    }
    return parsed;
  }

  private static Resolution parseResolution(String value) {
    return Resolution.valueOf(value.toUpperCase(Locale.ROOT));
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 1005);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}

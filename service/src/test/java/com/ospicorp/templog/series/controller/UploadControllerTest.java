package com.ospicorp.templog.series.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class UploadControllerTest {

  private static final String LOGGER_CSV = "DataHora;Temperatura (°C)\n"
      + "01/02/2024 10:00;23,5°C\n"
      + "01/02/2024 10:30;24,5\n"
      + "01/02/2024 11:00;24.1\n"
      + "01/02/2024 12:00;999999\n";

  @Autowired
  private TestRestTemplate restTemplate;

  private static HttpEntity<MultiValueMap<String, Object>> upload(String content, String filename) {
    MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
    body.add("file", new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
      @Override
      public String getFilename() {
        return filename;
      }
    });
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.MULTIPART_FORM_DATA);
    return new HttpEntity<>(body, headers);
  }

  private ResponseEntity<Map<String, Object>> postForMap(String url,
      HttpEntity<MultiValueMap<String, Object>> request) {
    return restTemplate.exchange(url, HttpMethod.POST, request,
        new ParameterizedTypeReference<Map<String, Object>>() {});
  }

  @Test
  @SuppressWarnings("unchecked")
  void uploadReturnsSeriesAndStats() {
    ResponseEntity<Map<String, Object>> response =
        postForMap("/api/upload", upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = Objects.requireNonNull(response.getBody());
    assertThat(body).containsEntry("time_key", "timestamp").containsEntry("temp_key", "temperature");

    List<Map<String, Object>> data = (List<Map<String, Object>>) body.get("data");
    assertThat(data).hasSize(3);
    assertThat(data.get(0)).containsEntry("timestamp", "2024-02-01T10:00:00")
        .containsEntry("temperature", 23.5);

    List<Map<String, Object>> hourly = (List<Map<String, Object>>) body.get("hourly");
    assertThat(hourly).hasSize(2);
    assertThat(hourly.get(0)).containsEntry("temperature", 24.0);

    Map<String, Object> stats = (Map<String, Object>) body.get("stats");
    assertThat(stats).containsEntry("count", 3)
        .containsEntry("max", 24.5)
        .containsEntry("time_col", "datahora")
        .containsEntry("temp_col", "temperatura(c)")
        .containsKeys("min", "avg", "start", "end");
  }

  @Test
  void csvFormatStreamsRawRows() {
    ResponseEntity<String> response = restTemplate.exchange("/api/upload?format=csv",
        HttpMethod.POST, upload(LOGGER_CSV, "logger.csv"), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(Objects.requireNonNull(response.getHeaders().getContentType()).toString())
        .startsWith("text/csv");
    assertThat(response.getBody())
        .startsWith("timestamp,temperature")
        .contains("2024-02-01T10:00:00,23.5")
        .contains("2024-02-01T11:00:00,24.1");
  }

  @Test
  void csvFormatCanReturnHourlyRows() {
    ResponseEntity<String> response = restTemplate.exchange(
        "/api/upload?format=csv&resolution=hourly",
        HttpMethod.POST, upload(LOGGER_CSV, "logger.csv"), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .contains("2024-02-01T10:00:00,24.0")
        .doesNotContain("10:30");
  }

  @Test
  void rangeNarrowsTheSeries() {
    ResponseEntity<Map<String, Object>> response = postForMap(
        "/api/upload?start=2024-02-01T10:15&end=01/02/2024 11:00",
        upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    @SuppressWarnings("unchecked")
    Map<String, Object> stats = (Map<String, Object>) Objects.requireNonNull(response.getBody())
        .get("stats");
    assertThat(stats).containsEntry("count", 2).containsEntry("start", "2024-02-01T10:30:00");
  }

  @Test
  void invalidStartReturnsErrorCode() {
    ResponseEntity<Map<String, Object>> response =
        postForMap("/api/upload?start=yesterday", upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("errorCode", 1001)
        .containsEntry("path", "/api/upload")
        .containsKeys("error", "moreInfo");
  }

  @Test
  void reversedRangeReturnsErrorCode() {
    ResponseEntity<Map<String, Object>> response = postForMap(
        "/api/upload?start=2024-02-02&end=2024-02-01", upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1003);
  }

  @Test
  void unknownFormatReturnsErrorCode() {
    ResponseEntity<Map<String, Object>> response =
        postForMap("/api/upload?format=xml", upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1005);
  }

  @Test
  void unknownResolutionIsRejectedByValidation() {
    ResponseEntity<Map<String, Object>> response = postForMap(
        "/api/upload?format=csv&resolution=daily", upload(LOGGER_CSV, "logger.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat((String) Objects.requireNonNull(response.getBody()).get("type"))
        .endsWith("/invalid-request");
  }

  @Test
  void unreadableFileReturnsProblemWithAttempts() {
    ResponseEntity<Map<String, Object>> response =
        postForMap("/api/upload", upload("just one column\n1\n", "log.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(Objects.requireNonNull(response.getHeaders().getContentType()).toString())
        .contains("application/problem+json");
    Map<String, Object> body = Objects.requireNonNull(response.getBody());
    assertThat((String) body.get("type")).endsWith("/unreadable-file");
    assertThat(body).containsKey("attempts");
  }

  @Test
  void noUsableSeriesListsColumnsTried() {
    ResponseEntity<Map<String, Object>> response = postForMap("/api/upload",
        upload("Data;Valor\n01/02/2024 10:00;abc\n01/02/2024 11:00;def\n", "log.csv"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    Map<String, Object> body = Objects.requireNonNull(response.getBody());
    assertThat((String) body.get("type")).endsWith("/no-usable-series");
    assertThat(body).containsEntry("columns", List.of("data", "valor"))
        .containsEntry("temp_cols_tried", List.of("data", "valor"));
  }
}

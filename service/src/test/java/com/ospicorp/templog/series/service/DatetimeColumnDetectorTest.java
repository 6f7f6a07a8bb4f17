package com.ospicorp.templog.series.service;

import static com.ospicorp.templog.series.service.TestTables.row;
import static com.ospicorp.templog.series.service.TestTables.table;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatetimeColumnDetectorTest {

  @Test
  void namedDateTimeColumnWins() {
    var detection = DatetimeColumnDetector.detect(table(List.of("DataHora", "Temperatura (°C)"),
        row("01/02/2024 10:00", "23,5"),
        row("01/02/2024 11:00", "24,1")));

    assertEquals("datahora", detection.column());
    assertFalse(detection.isPair());
    assertEquals(1.0, detection.score());
    assertEquals(LocalDateTime.of(2024, 2, 1, 11, 0), detection.timestamps().get(1));
  }

  @Test
  void separateDateAndTimeColumnsAreCombined() {
    var detection = DatetimeColumnDetector.detect(table(List.of("Data", "Hora", "Temp"),
        row("01/02/2024", "10:00", "20"),
        row("01/02/2024", "11:30", "21")));

    assertTrue(detection.isPair());
    assertEquals("data+hora", detection.label());
    assertEquals(List.of(LocalDateTime.of(2024, 2, 1, 10, 0),
        LocalDateTime.of(2024, 2, 1, 11, 30)), detection.timestamps());
  }

  @Test
  void fullTimestampColumnIsNotReplacedByAPair() {
    var detection = DatetimeColumnDetector.detect(table(List.of("Timestamp", "Data", "Hora"),
        row("2024-02-01 10:15", "01/02/2024", "10:00"),
        row("2024-02-01 11:15", "01/02/2024", "11:00")));

    assertEquals("timestamp", detection.label());
    assertEquals(LocalDateTime.of(2024, 2, 1, 10, 15), detection.timestamps().get(0));
  }

  @Test
  void scansEveryColumnWhenNoNameLooksLikeTime() {
    var detection = DatetimeColumnDetector.detect(table(List.of("Quando", "Valor"),
        row("2024-02-01 10:00", "20"),
        row("2024-02-01 11:00", "21")));

    assertEquals("quando", detection.column());
  }

  @Test
  void tiesKeepColumnOrder() {
    var detection = DatetimeColumnDetector.detect(table(List.of("Time", "Timestamp"),
        row("2024-02-01 10:00", "2024-02-01 10:00")));

    assertEquals("time", detection.column());
  }

  @Test
  void neverFailsOnUnparseableData() {
    var detection = DatetimeColumnDetector.detect(table(List.of("Momento", "Leitura"),
        row("ontem", "abc"),
        row("hoje", "def")));

    assertEquals("momento", detection.column());
    assertEquals(0d, detection.score());
    assertTrue(detection.timestamps().stream().allMatch(t -> t == null));
  }

  @Test
  void partiallyParseableScoreIsAShare() {
    var detection = DatetimeColumnDetector.detect(table(List.of("DataHora", "Temp"),
        row("01/02/2024 10:00", "20"),
        row("?", "21"),
        row("01/02/2024 12:00", "22"),
        row("01/02/2024 13:00", "23")));

    assertEquals(0.75, detection.score(), 1e-9);
    assertNull(detection.timestamps().get(1));
  }
}

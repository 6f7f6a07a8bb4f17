package com.ospicorp.templog.series.reader;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.templog.series.exception.UnreadableFileException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class CsvTableReaderTest {

  private final CsvTableReader reader = new CsvTableReader();

  @Test
  void readsSemicolonSeparatedBrazilianExport() {
    String csv = "DataHora;Temperatura (°C)\n01/02/2024 10:00;23,5\n01/02/2024 11:00;24,1\n";

    var table = reader.read(csv.getBytes(StandardCharsets.UTF_8));

    assertEquals(List.of("DataHora", "Temperatura (°C)"), table.columnNames());
    assertEquals(2, table.rowCount());
    assertEquals("23,5", table.cell(0, 1));
  }

  @Test
  void fallsBackToLatin1WhenBytesAreNotUtf8() {
    String csv = "Temperatura;Média\n20;19,5\n";

    var table = reader.read(csv.getBytes(StandardCharsets.ISO_8859_1));

    assertEquals(List.of("Temperatura", "Média"), table.columnNames());
  }

  @Test
  void readsTabsAndPipes() {
    assertEquals(2, reader.read("a\tb\n1\t2\n".getBytes(StandardCharsets.UTF_8))
        .columnNames().size());
    assertEquals(2, reader.read("a|b\n1|2\n".getBytes(StandardCharsets.UTF_8))
        .columnNames().size());
  }

  @Test
  void stripsByteOrderMarkAndPadsShortRows() {
    String csv = "\uFEFFHora,Temp,Obs\n10:00,20\n\n11:00,,ok\n";

    var table = reader.read(csv.getBytes(StandardCharsets.UTF_8));

    assertEquals("Hora", table.columnNames().get(0));
    assertEquals(2, table.rowCount());
    assertNull(table.cell(0, 2));
    assertNull(table.cell(1, 1));
    assertEquals("ok", table.cell(1, 2));
  }

  @Test
  void blankHeadersGetPositionalNames() {
    var table = reader.read("Hora,,Temp\n10:00,x,20\n".getBytes(StandardCharsets.UTF_8));

    assertEquals(List.of("Hora", "unnamed_1", "Temp"), table.columnNames());
  }

  @Test
  void countsRowsWiderThanTheHeader() {
    String csv = "Hora,Temp\n10:00,23,5\n11:00,24,1\n12:00,25\n";

    var parsed = reader.parse(csv.getBytes(StandardCharsets.UTF_8));

    assertEquals(2, parsed.overflowingRows());
    assertEquals("23", parsed.table().cell(0, 1));
  }

  @Test
  void warnsWhenExtraCellsAreDropped(CapturedOutput output) {
    String csv = "Hora,Temp\n10:00,23,5\n11:00,24,1\n";

    reader.read(csv.getBytes(StandardCharsets.UTF_8));

    assertTrue(output.getOut().contains("2 of 2 rows have more cells than the 2 header columns"));
  }

  @Test
  void rejectedVariantsDoNotCountAsOverflow() {
    String csv = "DataHora;Temperatura\n01/02/2024 10:00;23,5\n";

    assertEquals(0, reader.parse(csv.getBytes(StandardCharsets.UTF_8)).overflowingRows());
  }

  @Test
  void singleColumnTextIsUnreadable() {
    var ex = assertThrows(UnreadableFileException.class,
        () -> reader.read("abc\n1\n2\n".getBytes(StandardCharsets.UTF_8)));

    assertEquals("unreadable-file", ex.slug());
    assertEquals(CsvTableReader.DELIMITERS.size() * CsvTableReader.ENCODINGS.size(),
        ex.attempts().size());
    assertEquals("delimiter=',' encoding=UTF-8", ex.attempts().get(0));
  }
}

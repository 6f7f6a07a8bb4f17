package com.ospicorp.templog.series.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  void headerVariantsOfTheSameNameCollapse() {
    assertEquals("temperatura(c)", TextNormalizer.normalize("Temperatura (°C)"));
    assertEquals(TextNormalizer.normalize("Temperatura (°C)"),
        TextNormalizer.normalize("TEMPERATURA(°C)"));
  }

  @Test
  void trimsAndLowercases() {
    assertEquals("hora", TextNormalizer.normalize(" Hora "));
  }

  @Test
  void celsiusSignAndDegreeCAreUnified() {
    assertEquals("temperaturac", TextNormalizer.normalize("Temperatura ℃"));
    assertEquals("temperaturac", TextNormalizer.normalize("Temperatura °C"));
  }

  @Test
  void stripsAccentsAndWhitespace() {
    assertEquals("periodo", TextNormalizer.normalize("Período"));
    assertEquals("umidaderelativa(%)", TextNormalizer.normalize("Umidade\tRelativa\n(%)"));
    assertEquals("data/hora", TextNormalizer.normalize("Data / Hora"));
  }

  @Test
  void stringifiesNonStringInput() {
    assertEquals("42", TextNormalizer.normalize(42));
    assertEquals("null", TextNormalizer.normalize(null));
  }
}

package com.ospicorp.templog.series.model;

public enum Resolution {
  RAW,
  HOURLY
}

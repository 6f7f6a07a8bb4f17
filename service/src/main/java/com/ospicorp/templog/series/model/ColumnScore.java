package com.ospicorp.templog.series.model;

// Ranking entry for one candidate column; metrics are whatever the scorer measured
public record ColumnScore<M>(String column, double score, M metrics) {}

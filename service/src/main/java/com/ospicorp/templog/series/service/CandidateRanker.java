package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.ColumnScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Scores candidate columns with a caller-supplied function and orders them best first.
 * The sort is stable, so equal scores keep table column order.
 */
public final class CandidateRanker {
  private CandidateRanker() {
  }

  public static <M> List<ColumnScore<M>> rank(List<String> candidates,
      Function<String, ColumnScore<M>> scorer) {
    List<ColumnScore<M>> scored = new ArrayList<>(candidates.size());
    for (String column : candidates) {
      scored.add(scorer.apply(column));
    }
    scored.sort(Comparator.comparingDouble((ColumnScore<M> s) -> s.score()).reversed());
    return scored;
  }
}

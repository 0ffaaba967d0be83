package io.intellixity.strata.jdbc;

import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/** Records every statement and answers from a script. */
public final class RecordingQueryFn implements QueryFn {
  public record Call(String sql, List<Object> params) {}

  private final BiFunction<String, List<Object>, QueryResult> script;
  private final List<Call> calls = new ArrayList<>();

  public RecordingQueryFn(BiFunction<String, List<Object>, QueryResult> script) {
    this.script = script;
  }

  public static RecordingQueryFn returning(QueryResult result) {
    return new RecordingQueryFn((sql, params) -> result);
  }

  public static RecordingQueryFn empty() {
    return returning(QueryResult.empty());
  }

  @Override
  public QueryResult query(String sql, List<Object> params) {
    calls.add(new Call(sql, Collections.unmodifiableList(new ArrayList<>(params))));
    return script.apply(sql, params);
  }

  public List<Call> calls() {
    return calls;
  }

  public Call last() {
    return calls.get(calls.size() - 1);
  }
}

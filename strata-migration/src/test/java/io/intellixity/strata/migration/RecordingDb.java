package io.intellixity.strata.migration;

import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/** Records every statement and answers from a script. */
final class RecordingDb implements QueryFn {
  record Call(String sql, List<Object> params) {}

  private final BiFunction<String, List<Object>, QueryResult> script;
  private final List<Call> calls = new ArrayList<>();

  RecordingDb(BiFunction<String, List<Object>, QueryResult> script) {
    this.script = script;
  }

  RecordingDb() {
    this((sql, params) -> QueryResult.empty());
  }

  @Override
  public QueryResult query(String sql, List<Object> params) {
    calls.add(new Call(sql, Collections.unmodifiableList(new ArrayList<>(params))));
    return script.apply(sql, params);
  }

  List<Call> calls() {
    return calls;
  }

  List<String> statements() {
    List<String> out = new ArrayList<>(calls.size());
    for (Call c : calls) out.add(c.sql());
    return out;
  }
}

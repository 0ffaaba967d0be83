package io.intellixity.strata.jdbc.client;

import java.util.List;
import java.util.Map;

/** One page of rows plus the total number of rows matching the filter. */
public record Page(List<Map<String, Object>> data, long total) {
  public Page {
    data = data == null ? List.of() : List.copyOf(data);
  }
}

package io.intellixity.strata.spi.exec;

import java.util.List;

/**
 * The only outward call the engine makes: run one statement with ordered parameters.
 * Driver specifics, connection handling and transaction scoping live behind this seam.
 */
@FunctionalInterface
public interface QueryFn {
  QueryResult query(String sql, List<Object> params);
}

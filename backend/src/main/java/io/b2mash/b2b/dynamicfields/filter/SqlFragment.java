package io.b2mash.b2b.dynamicfields.filter;

import java.util.List;

/**
 * A rendered WHERE-clause fragment using JPA positional parameters.
 *
 * @param sql predicate text without a leading {@code WHERE}/{@code AND}; empty when nothing
 *     applies
 * @param parameters values for {@code ?start} .. {@code ?(nextParameterIndex - 1)}, in order
 * @param nextParameterIndex first index free for the caller's own parameters
 */
public record SqlFragment(String sql, List<Object> parameters, int nextParameterIndex) {

  public SqlFragment {
    parameters = List.copyOf(parameters);
  }

  public boolean isEmpty() {
    return sql.isEmpty();
  }
}

package com.evoila.rosetta.sql;

import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders plans as ANSI-style SQL over a {@code time} column.
 *
 * <p>Interval windows become {@code date_bin} buckets. Fill strategies, session, state, event and
 * count windows have no portable form and are omitted.
 */
@Component
public class SqlTranslator extends AbstractSqlTranslator {

  @Override
  public Dialect targetDialect() {
    return Dialect.SQL;
  }

  @Override
  protected String timeColumn() {
    return "time";
  }

  @Override
  protected String formatDuration(long millis) {
    return "INTERVAL '" + DurationUtils.formatSqlInterval(millis) + "'";
  }

  @Override
  protected Optional<String> bucketExpression(Window window, long intervalMs, String column) {
    return Optional.of(
        "date_bin('"
            + DurationUtils.formatSqlInterval(intervalMs)
            + "', "
            + identifier(column)
            + ", TIMESTAMP '1970-01-01 00:00:00')");
  }
}

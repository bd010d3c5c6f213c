package com.evoila.rosetta.sql;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import java.util.Locale;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * ANSI-style SELECT parser. Used directly for the {@code sql} dialect and as the fallback when
 * detection finds no dialect-specific signal.
 *
 * <p>{@code date_bin('5 minutes', time[, origin])} is read as a time bucket.
 */
@Component
public class SqlParser extends AbstractSqlParser {

  public SqlParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public SqlParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.SQL;
  }

  @Override
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    if (!call.lowerName().equals("date_bin")) {
      return false;
    }
    dateBin(call, alias, ordinal, context);
    return true;
  }

  @Override
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    Optional<FunctionCall> call = FunctionCall.parse(item);
    if (call.isEmpty() || !call.get().lowerName().equals("date_bin")) {
      return false;
    }
    dateBin(call.get(), null, -1, context);
    return true;
  }

  private void dateBin(FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    if (call.arguments().size() < 2) {
      throw new QueryParseException("date_bin requires a stride and a time column");
    }
    String stride = call.arguments().get(0).trim();
    if (stride.toLowerCase(Locale.ROOT).startsWith("interval")) {
      stride = stride.substring("interval".length()).trim();
    }
    timeBucket(
        DurationUtils.parseSqlInterval(StringParser.unquote(stride)),
        StringParser.unquote(call.arguments().get(1)),
        alias,
        ordinal,
        context);
  }
}

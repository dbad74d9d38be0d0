package net.pgtyped.client.log;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/** PQFormatter */
public class PQFormatter extends Formatter {
  private static final ThreadLocal<DateFormat> df =
      ThreadLocal.withInitial(
          () -> {
            DateFormat format = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");
            format.setTimeZone(TimeZone.getTimeZone("UTC"));
            return format;
          });

  public static final String CLASS_NAME_PREFIX = "net.pgtyped";

  @Override
  public String format(LogRecord record) {
    String className = record.getSourceClassName();
    String methodName = record.getSourceMethodName();
    if (className == null) {
      className = record.getLoggerName();
    } else if (className.startsWith(CLASS_NAME_PREFIX)) {
      className = "n.p" + className.substring(CLASS_NAME_PREFIX.length());
    }

    StringBuilder builder = new StringBuilder(256);
    builder.append(df.get().format(new Date(record.getMillis()))).append(" ");
    builder.append(className).append(" ");
    builder.append(record.getLevel()).append(" ");
    builder.append(methodName).append(" - ");
    builder.append(formatMessage(record));
    builder.append("\n");
    return builder.toString();
  }
}

package net.larse.tsforecast.timeseries;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.larse.tsforecast.errors.ConfigException;
import org.apache.commons.lang3.StringUtils;

/**
 * Time and value conversions shared by the data preparation and forecasting code.
 *
 * <p>All timestamps are held as epoch seconds in UTC; one second is the finest resolution.
 */
public final class TimeSeriesUtils {
  public static final long SECONDS_PER_DAY = 86400L;

  public static final DateTimeFormatter RECORD_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final DateTimeFormatter[] LOCAL_FORMATS = {
    DateTimeFormatter.ISO_LOCAL_DATE_TIME,
    RECORD_FORMAT,
    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
    DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
  };

  private static final Pattern COMPACT_DATE = Pattern.compile("^\\d{8}$");

  private static final Pattern DURATION =
      Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([a-z]+)$");

  private TimeSeriesUtils() {}

  /** Days elapsed since the Unix epoch, used as the phase reference of seasonal terms. */
  public static double epochDays(long epochSecond) {
    return epochSecond / (double) SECONDS_PER_DAY;
  }

  public static LocalDateTime toDateTime(long epochSecond) {
    return LocalDateTime.ofEpochSecond(epochSecond, 0, ZoneOffset.UTC);
  }

  public static LocalDate toDate(long epochSecond) {
    return LocalDate.ofEpochDay(Math.floorDiv(epochSecond, SECONDS_PER_DAY));
  }

  public static long toEpochSecond(LocalDateTime dateTime) {
    return dateTime.toEpochSecond(ZoneOffset.UTC);
  }

  public static long toEpochSecond(LocalDate date) {
    return date.toEpochDay() * SECONDS_PER_DAY;
  }

  public static String format(long epochSecond) {
    return RECORD_FORMAT.format(toDateTime(epochSecond));
  }

  /**
   * Parses a raw date value to epoch seconds.
   *
   * <p>Eight-digit strings are compact {@code yyyyMMdd} dates. Other numbers (and numeric strings)
   * are epoch seconds. Strings may be ISO dates, ISO date-times, offset date-times or
   * {@code yyyy-MM-dd HH:mm:ss}.
   *
   * @return the epoch second, or null when the value is missing or cannot be parsed
   */
  public static Long parseTimestamp(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? (long) Math.floor(d) : null;
    }
    if (value instanceof LocalDate) {
      return toEpochSecond((LocalDate) value);
    }
    if (value instanceof LocalDateTime) {
      return toEpochSecond((LocalDateTime) value);
    }
    if (value instanceof Instant) {
      return ((Instant) value).getEpochSecond();
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toEpochSecond();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toEpochSecond();
    }
    if (value instanceof Date) {
      return Math.floorDiv(((Date) value).getTime(), 1000L);
    }

    String text = StringUtils.trimToNull(value.toString());
    if (text == null) {
      return null;
    }
    if (COMPACT_DATE.matcher(text).matches()) {
      try {
        return toEpochSecond(LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE));
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    double numeric = parseDouble(text);
    if (!Double.isNaN(numeric)) {
      return (long) Math.floor(numeric);
    }
    try {
      return toEpochSecond(LocalDate.parse(text));
    } catch (DateTimeParseException e) {
      // not a plain date; try the date-time forms below
    }
    for (DateTimeFormatter format : LOCAL_FORMATS) {
      try {
        return toEpochSecond(LocalDateTime.parse(text, format));
      } catch (DateTimeParseException e) {
        // try the next format
      }
    }
    try {
      return OffsetDateTime.parse(text).toEpochSecond();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * Coerces a raw value to a double.
   *
   * @return the value, or NaN when it is missing, non-numeric or not finite
   */
  public static double parseDouble(Object value) {
    if (value == null) {
      return Double.NaN;
    }
    double d;
    if (value instanceof Number) {
      d = ((Number) value).doubleValue();
    } else {
      String text = StringUtils.trimToNull(value.toString());
      if (text == null) {
        return Double.NaN;
      }
      try {
        d = Double.parseDouble(text);
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    return Double.isFinite(d) ? d : Double.NaN;
  }

  /**
   * Parses durations such as {@code "730 days"}, {@code "12 hours"}, {@code "30 min"} or an
   * ISO-8601 duration ({@code "P30D"}).
   */
  public static Duration parseDuration(String text) throws ConfigException {
    String normalized = StringUtils.trimToEmpty(text).toLowerCase(Locale.ROOT);
    Matcher matcher = DURATION.matcher(normalized);
    if (matcher.matches()) {
      double amount = Double.parseDouble(matcher.group(1));
      long unitSeconds;
      switch (matcher.group(2)) {
        case "w":
        case "week":
        case "weeks":
          unitSeconds = 7 * SECONDS_PER_DAY;
          break;
        case "d":
        case "day":
        case "days":
          unitSeconds = SECONDS_PER_DAY;
          break;
        case "h":
        case "hour":
        case "hours":
          unitSeconds = 3600;
          break;
        case "m":
        case "min":
        case "minute":
        case "minutes":
          unitSeconds = 60;
          break;
        case "s":
        case "sec":
        case "second":
        case "seconds":
          unitSeconds = 1;
          break;
        default:
          throw new ConfigException("Unknown duration unit", text);
      }
      return Duration.ofSeconds(Math.round(amount * unitSeconds));
    }
    try {
      return Duration.parse(normalized.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException e) {
      throw new ConfigException("Unparseable duration", text, e);
    }
  }

  /** Smallest gap between consecutive timestamps, in seconds; Long.MAX_VALUE for fewer than 2. */
  public static long minSpacing(long[] timestamps) {
    long min = Long.MAX_VALUE;
    for (int i = 1; i < timestamps.length; i++) {
      min = Math.min(min, timestamps[i] - timestamps[i - 1]);
    }
    return min;
  }
}

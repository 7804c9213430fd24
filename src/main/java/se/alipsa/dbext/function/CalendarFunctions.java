package se.alipsa.dbext.function;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Scalar calendar and duration functions: {@code LAST_DAY}, {@code FORMAT_DURATION} and
 * {@code NORMALIZE_TIME}. A {@code null} argument yields a {@code null} result.
 */
public final class CalendarFunctions {

  private static final long MICROS_PER_SECOND = 1_000_000L;

  private CalendarFunctions() {
    // Utility class
  }

  /**
   * Evaluate a calendar function by name.
   *
   * @param name
   *          the upper case function name
   * @param args
   *          the function arguments
   * @return the result of the function, {@code null} for unknown names or {@code null} arguments
   */
  public static Object evaluate(String name, List<Object> args) {
    return switch (name) {
      case "LAST_DAY" -> {
        requireArgs(name, args, 1);
        yield lastDayOf(args.get(0));
      }
      case "FORMAT_DURATION" -> {
        requireArgs(name, args, 1);
        Object seconds = args.get(0);
        yield seconds == null ? null : formatDuration(((Number) seconds).intValue());
      }
      case "NORMALIZE_TIME" -> {
        requireArgs(name, args, 3);
        Object interval = args.get(2);
        yield normalizeTime(toTimestamp(args.get(0)), toTimestamp(args.get(1)),
            interval == null ? null : ((Number) interval).intValue());
      }
      default -> null;
    };
  }

  /**
   * The last day of the month of a date.
   *
   * @param date
   *          the date
   * @return the last day of the same month, or {@code null}
   */
  public static LocalDate lastDay(LocalDate date) {
    if (date == null) {
      return null;
    }
    return YearMonth.from(date).atEndOfMonth();
  }

  public static Date lastDay(Date date) {
    return date == null ? null : Date.valueOf(lastDay(date.toLocalDate()));
  }

  /**
   * The last day of the month of the date part of a timestamp.
   *
   * @param timestamp
   *          the timestamp
   * @return the last day of the month, or {@code null}
   */
  public static Date lastDay(Timestamp timestamp) {
    return timestamp == null ? null : Date.valueOf(lastDay(timestamp.toLocalDateTime().toLocalDate()));
  }

  /**
   * Render a number of seconds as {@code HH:MM:SS}. Hours beyond 99 are printed in full, negative
   * durations get a leading minus sign.
   *
   * @param seconds
   *          the duration in seconds
   * @return the formatted duration, or {@code null}
   */
  public static String formatDuration(Integer seconds) {
    if (seconds == null) {
      return null;
    }
    long total = Math.abs((long) seconds);
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    String formatted = String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, secs);
    return seconds < 0 ? "-" + formatted : formatted;
  }

  /**
   * Snap a timestamp down to the closest interval boundary at or after a base timestamp, i.e. the
   * greatest {@code base + k * interval} that is not after {@code in}.
   *
   * @param in
   *          the timestamp to normalize
   * @param base
   *          the first boundary
   * @param intervalSeconds
   *          the distance between boundaries, in seconds
   * @return the normalized timestamp, or {@code null}
   * @throws IllegalArgumentException
   *           if {@code base} is after {@code in} or the interval is not positive
   */
  public static Timestamp normalizeTime(Timestamp in, Timestamp base, Integer intervalSeconds) {
    if (in == null || base == null || intervalSeconds == null) {
      return null;
    }
    if (base.after(in)) {
      throw new IllegalArgumentException("Base timestamp cannot be greater than input timestamp");
    }
    if (intervalSeconds <= 0) {
      throw new IllegalArgumentException("Interval must be a positive number of seconds but was " + intervalSeconds);
    }
    Instant baseInstant = base.toInstant();
    long diff = ChronoUnit.MICROS.between(baseInstant, in.toInstant());
    long step = intervalSeconds * MICROS_PER_SECOND;
    if (diff == 0) {
      return in;
    }
    if (diff < step) {
      return base;
    }
    if (diff % step == 0) {
      return in;
    }
    return Timestamp.from(baseInstant.plus((diff / step) * step, ChronoUnit.MICROS));
  }

  private static Object lastDayOf(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Timestamp ts) {
      return lastDay(ts);
    }
    if (value instanceof Date d) {
      return lastDay(d);
    }
    if (value instanceof LocalDate ld) {
      return lastDay(ld);
    }
    if (value instanceof LocalDateTime ldt) {
      return lastDay(ldt.toLocalDate());
    }
    throw new IllegalArgumentException("LAST_DAY expects a date or timestamp but got " + value);
  }

  private static Timestamp toTimestamp(Object value) {
    if (value == null || value instanceof Timestamp) {
      return (Timestamp) value;
    }
    if (value instanceof LocalDateTime ldt) {
      return Timestamp.valueOf(ldt);
    }
    throw new IllegalArgumentException("Expected a timestamp but got " + value);
  }

  private static void requireArgs(String name, List<Object> args, int count) {
    if (args == null || args.size() != count) {
      throw new IllegalArgumentException(name + " expects " + count + " argument(s)");
    }
  }
}

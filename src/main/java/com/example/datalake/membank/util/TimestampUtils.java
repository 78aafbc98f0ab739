package com.example.datalake.membank.util;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Converts the assorted timestamp representations SQLite hands back (ISO text, "yyyy-MM-dd
 * HH:mm:ss" text from CURRENT_TIMESTAMP, epoch numbers, JDBC types) into UTC instants.
 */
public final class TimestampUtils {

  private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart().appendOffsetId().optionalEnd()
      .optionalEnd()
      .toFormatter();

  // epoch values above this are milliseconds rather than seconds
  private static final long MILLIS_THRESHOLD = 100_000_000_000L;

  private TimestampUtils() {}

  /** Returns null for null or unparseable input. */
  public static Instant toInstant(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Timestamp ts) {
      return ts.toInstant();
    }
    if (value instanceof Date date) {
      return Instant.ofEpochMilli(date.getTime());
    }
    if (value instanceof OffsetDateTime odt) {
      return odt.toInstant();
    }
    if (value instanceof ZonedDateTime zdt) {
      return zdt.toInstant();
    }
    if (value instanceof LocalDateTime ldt) {
      return ldt.toInstant(ZoneOffset.UTC);
    }
    if (value instanceof Number number) {
      long raw = number.longValue();
      return raw > MILLIS_THRESHOLD ? Instant.ofEpochMilli(raw) : Instant.ofEpochSecond(raw);
    }
    return parse(value.toString());
  }

  private static Instant parse(String text) {
    String s = text.trim();
    if (s.isEmpty()) {
      return null;
    }
    TemporalAccessor parsed;
    try {
      parsed = FLEXIBLE.parseBest(s, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
    } catch (DateTimeParseException e) {
      return null;
    }
    if (parsed instanceof OffsetDateTime odt) {
      return odt.toInstant();
    }
    if (parsed instanceof LocalDateTime ldt) {
      return ldt.toInstant(ZoneOffset.UTC);
    }
    return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
  }
}

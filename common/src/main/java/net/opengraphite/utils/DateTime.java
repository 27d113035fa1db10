// This file is part of OpenGraphite.
// Copyright (C) 2024  The OpenGraphite Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opengraphite.utils;

import com.google.common.base.Strings;

import net.opengraphite.exceptions.InvalidArgumentException;

/**
 * Clock access and Graphite style interval parsing. All methods are static.
 * 
 * @since 1.0
 */
public class DateTime {

  /** Seconds per unit. */
  private static final long MINUTE = 60;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;
  
  /**
   * Parses a Graphite interval such as "5min", "-1d" or "1h30min" into 
   * seconds. Multiple segments are summed. A leading "+" or "-" sets the sign
   * of the whole interval, otherwise the default sign applies.
   * <p>
   * Units: s, sec, secs, second, seconds; m, min, mins, minute, minutes; h,
   * hour, hours; d, day, days; w, week, weeks; mon, month, months (30 days);
   * y, year, years (365 days).
   * @param interval A non-null and non-empty interval.
   * @param default_sign The sign to apply when none is given, 1 or -1.
   * @return The interval in seconds.
   * @throws InvalidArgumentException if the interval was empty, a segment
   * lacked a number or the unit was unknown.
   */
  public static long parseInterval(final String interval, 
                                   final int default_sign) {
    if (Strings.isNullOrEmpty(interval)) {
      throw new InvalidArgumentException(
          InvalidArgumentException.Reason.INVALID_VALUE, 
          "Interval cannot be null or empty.");
    }
    int sign = default_sign;
    int idx = 0;
    if (interval.charAt(0) == '-') {
      sign = -1;
      idx++;
    } else if (interval.charAt(0) == '+') {
      sign = 1;
      idx++;
    }
    
    if (idx >= interval.length()) {
      throw new InvalidArgumentException(
          InvalidArgumentException.Reason.INVALID_VALUE, 
          "Interval is missing a value: " + interval);
    }
    
    long total = 0;
    while (idx < interval.length()) {
      int end = idx;
      while (end < interval.length() && 
          Character.isDigit(interval.charAt(end))) {
        end++;
      }
      if (end == idx) {
        throw new InvalidArgumentException(
            InvalidArgumentException.Reason.INVALID_VALUE, 
            "Interval segment is missing a number: " + interval);
      }
      final long offset;
      try {
        offset = Long.parseLong(interval.substring(idx, end));
      } catch (NumberFormatException e) {
        throw new InvalidArgumentException(
            InvalidArgumentException.Reason.INVALID_VALUE, 
            "Invalid interval number: " + interval, e);
      }
      
      idx = end;
      while (end < interval.length() && 
          Character.isLetter(interval.charAt(end))) {
        end++;
      }
      final String units = interval.substring(idx, end);
      idx = end;
      total += sign * offset * unitSeconds(units, interval);
    }
    return total;
  }
  
  /**
   * Aligns the timestamp down to a multiple of the bucket width.
   * @param timestamp A timestamp in seconds.
   * @param bucket A bucket width greater than zero in seconds.
   * @return The aligned timestamp.
   */
  public static long alignDown(final long timestamp, final long bucket) {
    return Math.floorDiv(timestamp, bucket) * bucket;
  }
  
  /** @return The current JVM nano time. Wrapped for tests. */
  public static long nanoTime() {
    return System.nanoTime();
  }
  
  /**
   * @param end The end timestamp in nanoseconds.
   * @param start The start timestamp in nanoseconds.
   * @return The difference in milliseconds as a double.
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end 
          + ") cannot be less than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1_000_000;
  }
  
  private static long unitSeconds(final String units, final String interval) {
    switch (units) {
    case "s":
    case "sec":
    case "secs":
    case "second":
    case "seconds":
      return 1;
    case "m":
    case "min":
    case "mins":
    case "minute":
    case "minutes":
      return MINUTE;
    case "h":
    case "hour":
    case "hours":
      return HOUR;
    case "d":
    case "day":
    case "days":
      return DAY;
    case "w":
    case "week":
    case "weeks":
      return 7 * DAY;
    case "mon":
    case "month":
    case "months":
      return 30 * DAY;
    case "y":
    case "year":
    case "years":
      return 365 * DAY;
    default:
      throw new InvalidArgumentException(
          InvalidArgumentException.Reason.UNKNOWN_TIME_UNITS, 
          "Unknown time units '" + units + "' in interval: " + interval);
    }
  }
}

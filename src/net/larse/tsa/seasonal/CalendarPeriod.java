/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.seasonal;

import java.time.ZonedDateTime;

/** Calendar bucketing of timestamps. */
public enum CalendarPeriod {
  /** Hour of day, 0 to 23. */
  DAILY {
    @Override
    int bucket(ZonedDateTime time) {
      return time.getHour();
    }
  },
  /** Day of week, 0 (Sunday) to 6. */
  WEEKLY {
    @Override
    int bucket(ZonedDateTime time) {
      return time.getDayOfWeek().getValue() % 7;
    }
  },
  /** Day of month, 1 to 31. */
  MONTHLY {
    @Override
    int bucket(ZonedDateTime time) {
      return time.getDayOfMonth();
    }
  };

  abstract int bucket(ZonedDateTime time);
}

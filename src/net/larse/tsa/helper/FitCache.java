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
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * A caller-owned cache of fitted values keyed by metric id and option fingerprint.
 *
 * <p>Writers publish a new immutable map with a compare-and-set swap, so readers always see either
 * the old or the new entry set and never a partially written one.
 */
public final class FitCache<V> {
  private final AtomicReference<ImmutableMap<Key, V>> entries =
      new AtomicReference<>(ImmutableMap.<Key, V>of());

  public V get(String metricId, AnalysisArgs args) {
    return entries.get().get(new Key(metricId, args.fingerprint()));
  }

  /** Returns the cached value, computing and publishing it on a miss. */
  public V computeIfAbsent(String metricId, AnalysisArgs args, Supplier<V> compute) {
    Key key = new Key(metricId, args.fingerprint());
    V cached = entries.get().get(key);
    if (cached != null) {
      return cached;
    }
    V value = Preconditions.checkNotNull(compute.get(), "Computed value is null");
    while (true) {
      ImmutableMap<Key, V> current = entries.get();
      V raced = current.get(key);
      if (raced != null) {
        return raced;
      }
      ImmutableMap<Key, V> next = ImmutableMap.<Key, V>builder()
          .putAll(current)
          .put(key, value)
          .build();
      if (entries.compareAndSet(current, next)) {
        return value;
      }
    }
  }

  /** Drops every entry of the metric. */
  public void invalidate(String metricId) {
    while (true) {
      ImmutableMap<Key, V> current = entries.get();
      ImmutableMap.Builder<Key, V> next = ImmutableMap.builder();
      for (Map.Entry<Key, V> entry : current.entrySet()) {
        if (!entry.getKey().metricId.equals(metricId)) {
          next.put(entry);
        }
      }
      if (entries.compareAndSet(current, next.build())) {
        return;
      }
    }
  }

  public void clear() {
    entries.set(ImmutableMap.<Key, V>of());
  }

  public int size() {
    return entries.get().size();
  }

  /** An immutable view of the current entries, keyed by "metricId/fingerprint". */
  public ImmutableMap<String, V> snapshot() {
    ImmutableMap.Builder<String, V> view = ImmutableMap.builder();
    for (Map.Entry<Key, V> entry : entries.get().entrySet()) {
      view.put(entry.getKey().metricId + "/" + entry.getKey().fingerprint, entry.getValue());
    }
    return view.build();
  }

  private static final class Key {
    final String metricId;
    final String fingerprint;

    Key(String metricId, String fingerprint) {
      this.metricId = Preconditions.checkNotNull(metricId);
      this.fingerprint = fingerprint;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Key)) {
        return false;
      }
      Key other = (Key) o;
      return metricId.equals(other.metricId) && fingerprint.equals(other.fingerprint);
    }

    @Override
    public int hashCode() {
      return Objects.hash(metricId, fingerprint);
    }
  }
}

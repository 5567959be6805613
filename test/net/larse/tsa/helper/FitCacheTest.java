package net.larse.tsa.helper;

import com.google.common.collect.ImmutableMap;

import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class FitCacheTest {
  private FitCache<String> cache;
  private AnalysisArgs args;

  @Before
  public void setUp() {
    cache = new FitCache<>();
    args = new AnalysisArgs();
  }

  @Test
  public void testComputesOncePerKey() {
    final AtomicInteger calls = new AtomicInteger();
    for (int i = 0; i < 3; i++) {
      String value = cache.computeIfAbsent("cpu", args, () -> "fit" + calls.incrementAndGet());
      assertEquals("fit1", value);
    }
    assertEquals(1, calls.get());
    assertEquals("fit1", cache.get("cpu", args));
  }

  @Test
  public void testKeyIncludesArguments() {
    cache.computeIfAbsent("cpu", args, () -> "default");
    AnalysisArgs other = new AnalysisArgs();
    other.horizon = 30;
    assertNull(cache.get("cpu", other));
    assertEquals("long", cache.computeIfAbsent("cpu", other, () -> "long"));
    assertEquals(2, cache.size());
  }

  @Test
  public void testSnapshotIsNotAffectedByLaterWrites() {
    cache.computeIfAbsent("cpu", args, () -> "a");
    ImmutableMap<String, String> before = cache.snapshot();
    cache.computeIfAbsent("memory", args, () -> "b");
    assertEquals(1, before.size());
    assertEquals(2, cache.snapshot().size());
    assertTrue(before.containsKey("cpu/" + args.fingerprint()));
  }

  @Test
  public void testInvalidateDropsOnlyThatMetric() {
    cache.computeIfAbsent("cpu", args, () -> "a");
    cache.computeIfAbsent("memory", args, () -> "b");
    cache.invalidate("cpu");
    assertNull(cache.get("cpu", args));
    assertEquals("b", cache.get("memory", args));
    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test
  public void testConcurrentWritersPublishEveryEntry() throws Exception {
    Thread[] writers = new Thread[4];
    for (int t = 0; t < writers.length; t++) {
      final int offset = t;
      writers[t] = new Thread(() -> {
        for (int i = 0; i < 50; i++) {
          String metric = "m" + (offset * 50 + i);
          cache.computeIfAbsent(metric, args, () -> metric);
        }
      });
      writers[t].start();
    }
    for (Thread writer : writers) {
      writer.join();
    }
    assertEquals(200, cache.size());
  }
}

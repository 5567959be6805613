package net.larse.tsa.helper;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.io.InputStream;
import java.time.ZoneId;

import static org.junit.Assert.*;

public class AnalysisArgsTest {

  @Test
  public void testDefaultsAreValid() {
    AnalysisArgs args = new AnalysisArgs().validate();
    assertEquals("30d", args.timeWindow);
    assertEquals(10, args.minDataPoints);
    assertEquals(0.8, args.confidenceThreshold, 0);
    assertEquals(0.7, args.sensitivity, 0);
    assertEquals(24, args.anomalyWindow);
    assertEquals(7, args.horizon);
    assertEquals(0.2, args.validationSplit, 0);
    assertEquals(3, args.clusterCount);
    assertEquals(ZoneId.of("UTC"), args.zoneId());
  }

  @Test
  public void testApplyConvertsStringsAndNumbers() {
    AnalysisArgs args = new AnalysisArgs();
    args.apply(ImmutableMap.<String, Object>of(
        "sensitivity", "0.5", "horizon", 3, "randomSeed", "11", "timeWindow", " 7d "));
    assertEquals(0.5, args.sensitivity, 0);
    assertEquals(3, args.horizon);
    assertEquals(11L, args.randomSeed);
    assertEquals("7d", args.timeWindow);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownArgumentIsRejected() {
    new AnalysisArgs().apply(ImmutableMap.of("horizonn", "3"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparsableValueIsRejected() {
    new AnalysisArgs().apply(ImmutableMap.of("horizon", "three"));
  }

  @Test
  public void testValidateRejectsOutOfRangeValues() {
    String[][] invalid = {
        {"sensitivity", "0"},
        {"sensitivity", "1.5"},
        {"validationSplit", "1"},
        {"horizon", "0"},
        {"windowSize", "1"},
        {"clusterCount", "1"},
        {"minAgreement", "4"},
        {"zone", "Mars/Olympus"},
    };
    for (String[] entry : invalid) {
      AnalysisArgs args = new AnalysisArgs();
      args.apply(ImmutableMap.of(entry[0], entry[1]));
      try {
        args.validate();
        fail(entry[0] + "=" + entry[1] + " should be rejected");
      } catch (IllegalArgumentException expected) {
        // expected
      }
    }
  }

  @Test
  public void testLoadFromProperties() throws Exception {
    AnalysisArgs args = new AnalysisArgs();
    try (InputStream in = getClass().getResourceAsStream("analysis.properties")) {
      assertNotNull(in);
      args.load(in);
    }
    args.validate();
    assertEquals(0.5, args.sensitivity, 0);
    assertEquals(14, args.horizon);
    assertEquals(7L, args.randomSeed);
    assertEquals(ZoneId.of("Europe/Berlin"), args.zoneId());
    // untouched
    assertEquals(24, args.anomalyWindow);
  }

  @Test
  public void testFingerprintFollowsValues() {
    AnalysisArgs a = new AnalysisArgs();
    AnalysisArgs b = new AnalysisArgs();
    assertEquals(a.fingerprint(), b.fingerprint());
    b.horizon = 8;
    assertNotEquals(a.fingerprint(), b.fingerprint());
  }

  @Test
  public void testCopyIsIndependent() {
    AnalysisArgs original = new AnalysisArgs();
    original.iqrMultiplier = 3.0;
    AnalysisArgs copy = original.copy();
    original.iqrMultiplier = 1.0;
    assertEquals(3.0, copy.iqrMultiplier, 0);
    assertEquals(original.asMap().keySet(), copy.asMap().keySet());
  }
}

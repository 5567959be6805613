package net.larse.tsa.helper;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;

import static org.junit.Assert.*;

public class LinearLeastSquaresTest {

  @Test
  public void testRecoversQuadratic() {
    LinearLeastSquares lls = new LinearLeastSquares(3);
    for (int i = 0; i < 10; i++) {
      lls.addInput(new double[] {1, i, i * i}, 1 + 2 * i + 3 * i * i);
    }
    DenseMatrix64F results = new DenseMatrix64F(3, 1);
    assertTrue(lls.getSolution(results));
    assertEquals(1, results.get(0, 0), 1e-6);
    assertEquals(2, results.get(1, 0), 1e-6);
    assertEquals(3, results.get(2, 0), 1e-6);
    assertEquals(1, lls.getRSquared(results), 1e-9);
    assertEquals(0, lls.getRmsResidual(results), 1e-2);
    assertEquals(10, lls.getNumInputs());
  }

  @Test
  public void testTooFewInputs() {
    LinearLeastSquares lls = new LinearLeastSquares(3);
    lls.addInput(new double[] {1, 0, 0}, 1);
    lls.addInput(new double[] {1, 1, 1}, 2);
    assertFalse(lls.getSolution(new DenseMatrix64F(3, 1)));
  }

  @Test
  public void testResetClearsInputs() {
    LinearLeastSquares lls = new LinearLeastSquares(2);
    lls.addInput(new double[] {1, 0}, 5);
    lls.addInput(new double[] {1, 1}, 7);
    lls.reset();
    assertEquals(0, lls.getNumInputs());
    assertFalse(lls.getSolution(new DenseMatrix64F(2, 1)));
  }
}

/*
 * Copyright (c) 2015 Google, Inc.
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

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

import java.util.Arrays;

/**
 * Computes a multivariate linear regression of one dependent variable via ordinary least squares.
 */
public class LinearLeastSquares {
  public final int numX;

  private int numInputs;
  // the lower-left elements of xMat, row by row
  private final double[] xSums;
  // the elements of yMat
  private final double[] ySums;
  private double ySum;
  private double y2Sum;

  private boolean solved;

  private DenseMatrix64F xMat;
  private DenseMatrix64F yMat;
  private LinearSolver<DenseMatrix64F> solver;

  /**
   * Creates a solver for numX independent variables. Callers that want an intercept pass a
   * constant 1 as one of the x values.
   *
   * <p>To use the solver, call addInput() at least numX times, and then call getSolution() (and,
   * optionally, getRSquared() or getRmsResidual()).
   */
  public LinearLeastSquares(int numX) {
    Preconditions.checkArgument(numX >= 1);
    this.numX = numX;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numX];
  }

  // With X holding one observation per row and Y the matching column of dependent values:
  //    xMat = transpose(X) * X
  //    yMat = transpose(X) * Y
  // and the coefficients R solve xMat * R = yMat.
  //
  // Both are built incrementally without storing X and Y:
  //   xMat[i, j] = sum(x_i * x_j)
  //   yMat[i]    = sum(x_i * y)
  // xMat is symmetric, so only its lower triangle is accumulated.

  /** Adds one observation: numX values from x and the dependent value y. */
  public void addInput(double[] x, double y) {
    Preconditions.checkArgument(x.length == numX, "Expected %s values, got %s", numX, x.length);
    ++numInputs;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += xi * x[i2];
      }
      ySums[i] += xi * y;
    }
    ySum += y;
    y2Sum += y * y;
    solved = false;
  }

  /**
   * Computes the coefficients from the accumulated state. Returns false if there were not enough
   * inputs or the normal equations are singular. Returns true on success, and sets results to a
   * numX by 1 column of coefficients.
   */
  public boolean getSolution(DenseMatrix64F results) {
    if (numInputs < numX) {
      return false;
    }
    if (xMat == null) {
      xMat = new DenseMatrix64F(numX, numX);
      // yMat aliases the ySums array
      yMat = DenseMatrix64F.wrap(numX, 1, ySums);
      solver = LinearSolverFactory.symmPosDef(numX);
    }
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    solved = false;
    if (solver.setA(xMat) && solver.quality() > 0) {
      results.reshape(numX, 1, false);
      solver.solve(yMat, results);
      solved = true;
    }
    return solved;
  }

  /** Sum of squared residuals; requires a successful getSolution() with the given results. */
  private double sumSquaredResiduals(DenseMatrix64F results) {
    Preconditions.checkState(solved, "No solution computed");
    double sumSq = y2Sum;
    for (int j = 0; j < numX; ++j) {
      sumSq -= results.unsafe_get(j, 0) * ySums[j];
    }
    // due to roundoff, sumSq could end up slightly negative
    return Math.max(0, sumSq);
  }

  /** Square root of the mean squared residual. */
  public double getRmsResidual(DenseMatrix64F results) {
    return Math.sqrt(sumSquaredResiduals(results) / numInputs);
  }

  /**
   * Coefficient of determination against the mean of y, clamped to [0, 1]. Assumes the model has an
   * intercept column. 0 when y has no variance.
   */
  public double getRSquared(DenseMatrix64F results) {
    double total = y2Sum - ySum * ySum / numInputs;
    if (total <= 0) {
      return 0;
    }
    return ArrayHelper.clamp01(1 - sumSquaredResiduals(results) / total);
  }

  public int getNumInputs() {
    return numInputs;
  }

  /** Reset the solver to its no-inputs state. */
  public void reset() {
    numInputs = 0;
    Arrays.fill(xSums, 0);
    Arrays.fill(ySums, 0);
    ySum = 0;
    y2Sum = 0;
    solved = false;
  }
}

/*
 * Copyright (c) 2025 The imcomplexity Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.imcomplexity.datamodel;

import io.github.imcomplexity.util.exceptions.DimensionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RegionMaskTest {

  @Test
  void anyPositiveValueIsInRegion() {
    final RegionMask mask = RegionMask.fromValues(new double[][]{{0, 1, 127}, {128, 255, -3}});
    Assertions.assertFalse(mask.isInRegion(0, 0));
    Assertions.assertTrue(mask.isInRegion(0, 1));
    // below the display cutoff but still scored
    Assertions.assertTrue(mask.getValue(0, 2) < RegionMask.DISPLAY_CUTOFF);
    Assertions.assertTrue(mask.isInRegion(0, 2));
    Assertions.assertFalse(mask.isInRegion(1, 2));
  }

  @Test
  void fromBooleans() {
    final RegionMask mask = RegionMask.fromBooleans(new boolean[][]{{true, false}});
    Assertions.assertEquals(1, mask.getHeight());
    Assertions.assertEquals(2, mask.getWidth());
    Assertions.assertTrue(mask.isInRegion(0, 0));
    Assertions.assertFalse(mask.isInRegion(0, 1));
  }

  @Test
  void shapes() {
    Assertions.assertTrue(RegionMask.fromValues(new double[0][0]).hasZeroArea());
    Assertions.assertTrue(RegionMask.fromValues(new double[2][0]).hasZeroArea());
    Assertions.assertFalse(RegionMask.filled(1, 1, 0).hasZeroArea());
    Assertions.assertThrows(DimensionException.class,
        () -> RegionMask.fromValues(new double[][]{{1, 2}, {3}}));
  }
}

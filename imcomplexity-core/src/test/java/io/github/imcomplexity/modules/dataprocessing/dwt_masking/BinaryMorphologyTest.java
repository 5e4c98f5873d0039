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

package io.github.imcomplexity.modules.dataprocessing.dwt_masking;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BinaryMorphologyTest {

  @Test
  void structures() {
    final boolean[][] cross = BinaryMorphology.generateStructure(1);
    Assertions.assertFalse(cross[0][0]);
    Assertions.assertTrue(cross[0][1]);
    Assertions.assertTrue(cross[1][1]);

    final boolean[][] square = BinaryMorphology.iterateStructure(
        BinaryMorphology.generateStructure(2), 2);
    Assertions.assertEquals(5, square.length);
    for (boolean[] row : square) {
      Assertions.assertEquals(5, row.length);
      for (boolean b : row) {
        Assertions.assertTrue(b);
      }
    }

    // a cross iterated twice is a diamond
    final boolean[][] diamond = BinaryMorphology.iterateStructure(cross, 2);
    Assertions.assertTrue(diamond[0][2]);
    Assertions.assertFalse(diamond[0][1]);
    Assertions.assertTrue(diamond[1][1]);

    Assertions.assertThrows(IllegalArgumentException.class,
        () -> BinaryMorphology.iterateStructure(cross, 0));
  }

  @Test
  void erosionShrinksFromArrayBorder() {
    final boolean[][] all = new boolean[7][7];
    for (boolean[] row : all) {
      java.util.Arrays.fill(row, true);
    }
    final boolean[][] eroded = BinaryMorphology.erode(all, MaskProjector.getErosionStructure());
    for (int r = 0; r < 7; r++) {
      for (int x = 0; x < 7; x++) {
        final boolean inner = r >= 2 && r <= 4 && x >= 2 && x <= 4;
        Assertions.assertEquals(inner, eroded[r][x], r + "," + x);
      }
    }
  }

  @Test
  void erosionRemovesSmallRegions() {
    final boolean[][] input = new boolean[9][9];
    for (int r = 3; r < 7; r++) {
      for (int x = 3; x < 7; x++) {
        input[r][x] = true;
      }
    }
    // 4x4 cannot contain a 5x5 element
    final boolean[][] eroded = BinaryMorphology.erode(input, MaskProjector.getErosionStructure());
    for (boolean[] row : eroded) {
      for (boolean b : row) {
        Assertions.assertFalse(b);
      }
    }
  }

  @Test
  void dilation() {
    final boolean[][] point = new boolean[5][5];
    point[2][2] = true;
    final boolean[][] grown = BinaryMorphology.dilate(point,
        BinaryMorphology.generateStructure(1));
    Assertions.assertTrue(grown[1][2]);
    Assertions.assertTrue(grown[2][3]);
    Assertions.assertFalse(grown[1][1]);
    Assertions.assertFalse(grown[0][2]);
  }
}

/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.sputterlog.condition;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class ConditionTest {
  private static final Condition A = Condition.of(true, true, false, false);
  private static final Condition B = Condition.of(true, false, true, false);

  @Test
  public void testBooleanAlgebra() throws Exception {
    Assert.assertEquals("and", Condition.of(true, false, false, false), A.and(B));
    Assert.assertEquals("or", Condition.of(true, true, true, false), A.or(B));
    Assert.assertEquals("not", Condition.of(false, false, true, true), A.not());
    Assert.assertEquals("Combinators leave their operands alone", Condition.of(true, true, false, false), A);
  }

  @Test
  public void testAnyOf() throws Exception {
    Assert.assertEquals("OR of several conditions", A.or(B), Condition.anyOf(4, Arrays.asList(A, B)));
    Assert.assertEquals("OR of nothing is all-false", Condition.allFalse(4),
        Condition.anyOf(4, Collections.<Condition>emptyList()));
  }

  @Test
  public void testOrShiftedEarlierMarksTheSampleBeforeEachTrueSample() throws Exception {
    Assert.assertEquals("Each run grows by one sample to the left",
        Condition.of(false, true, true, true, false, true, true),
        Condition.of(false, false, true, true, false, false, true).orShiftedEarlier());
  }

  @Test
  public void testCountsAndIndices() throws Exception {
    Condition c = Condition.of(false, true, false, true, true);
    Assert.assertEquals("count", 3, c.count());
    Assert.assertEquals("first index", 1, c.firstIndex());
    Assert.assertEquals("last index", 4, c.lastIndex());
    Assert.assertArrayEquals("indices", new int[] {1, 3, 4}, c.indices());
    Assert.assertTrue("any", c.any());
    Assert.assertTrue("none", Condition.allFalse(3).none());
    Assert.assertEquals("No first index when nothing holds", -1, Condition.allFalse(3).firstIndex());
  }

  @Test
  public void testMaskIsCopied() throws Exception {
    boolean[] mask = new boolean[] {true, false};
    Condition c = Condition.of(mask);
    mask[1] = true;
    Assert.assertFalse("Later changes to the array do not leak into the condition", c.get(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSizesMustMatch() throws Exception {
    A.and(Condition.allTrue(3));
  }
}

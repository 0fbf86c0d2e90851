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

package com.twentyn.sputterlog.event;

import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.condition.Condition;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class DomainExtractorTest {
  private static final double TIMESTEP = 1000.0;

  private static long[] times(int size) {
    long[] times = new long[size];
    for (int i = 0; i < size; i++) {
      times[i] = SputterLogFixture.timeOf(i);
    }
    return times;
  }

  static Condition rows(int size, int... bounds) {
    boolean[] mask = new boolean[size];
    for (int r = 0; r < bounds.length; r += 2) {
      for (int i = bounds[r]; i <= bounds[r + 1]; i++) {
        mask[i] = true;
      }
    }
    return Condition.of(mask);
  }

  static Domain domain(int firstRow, int lastRow) {
    return new Domain(SputterLogFixture.timeOf(firstRow), SputterLogFixture.timeOf(lastRow));
  }

  @Test
  public void testNoSelectedSampleYieldsNoDomain() throws Exception {
    Assert.assertTrue("Empty condition",
        DomainExtractor.extract(times(20), Condition.allFalse(20), TIMESTEP, 10.0, 3.0).isEmpty());
  }

  @Test
  public void testEverySampleSelectedYieldsOneDomain() throws Exception {
    Assert.assertEquals("Whole log", Arrays.asList(domain(0, 19)),
        DomainExtractor.extract(times(20), Condition.allTrue(20), TIMESTEP, 10.0, 3.0));
  }

  @Test
  public void testGapsWiderThanTheContinuityLimitSplitDomains() throws Exception {
    List<Domain> domains = DomainExtractor.extract(times(50), rows(50, 0, 9, 25, 40), TIMESTEP, 10.0, 3.0);
    Assert.assertEquals("A 16 s gap splits", Arrays.asList(domain(0, 9), domain(25, 40)), domains);

    domains = DomainExtractor.extract(times(50), rows(50, 0, 9, 15, 20), TIMESTEP, 10.0, 3.0);
    Assert.assertEquals("A 6 s gap is tolerated", Arrays.asList(domain(0, 20)), domains);
  }

  @Test
  public void testShortDomainsAreDropped() throws Exception {
    List<Domain> domains = DomainExtractor.extract(times(50), rows(50, 0, 1, 20, 23), TIMESTEP, 10.0, 3.0);
    Assert.assertEquals("The 1 s blip is noise, the 3 s domain is kept", Arrays.asList(domain(20, 23)), domains);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testConditionMustCoverTheSeries() throws Exception {
    DomainExtractor.extract(times(10), Condition.allTrue(11), TIMESTEP, 10.0, 3.0);
  }
}

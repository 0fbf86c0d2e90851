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

import java.util.Arrays;
import java.util.Collection;

/**
 * A per-sample predicate over a time series, stored as a boolean mask aligned with the series' rows.  Conditions are
 * immutable; every combinator returns a new instance.
 */
public final class Condition {
  private final boolean[] mask;

  private Condition(boolean[] mask) {
    this.mask = mask;
  }

  public static Condition of(boolean... mask) {
    return new Condition(Arrays.copyOf(mask, mask.length));
  }

  public static Condition allFalse(int size) {
    return new Condition(new boolean[size]);
  }

  public static Condition allTrue(int size) {
    boolean[] mask = new boolean[size];
    Arrays.fill(mask, true);
    return new Condition(mask);
  }

  /**
   * OR of all the given conditions; all-false when there are none.
   */
  public static Condition anyOf(int size, Collection<Condition> conditions) {
    Condition result = allFalse(size);
    for (Condition c : conditions) {
      result = result.or(c);
    }
    return result;
  }

  static Condition wrap(boolean[] mask) {
    return new Condition(mask);
  }

  public int size() {
    return mask.length;
  }

  public boolean get(int row) {
    return mask[row];
  }

  public Condition and(Condition other) {
    checkSize(other);
    boolean[] result = new boolean[mask.length];
    for (int i = 0; i < mask.length; i++) {
      result[i] = mask[i] && other.mask[i];
    }
    return new Condition(result);
  }

  public Condition or(Condition other) {
    checkSize(other);
    boolean[] result = new boolean[mask.length];
    for (int i = 0; i < mask.length; i++) {
      result[i] = mask[i] || other.mask[i];
    }
    return new Condition(result);
  }

  public Condition not() {
    boolean[] result = new boolean[mask.length];
    for (int i = 0; i < mask.length; i++) {
      result[i] = !mask[i];
    }
    return new Condition(result);
  }

  /**
   * Also marks every sample that immediately precedes a true sample.  Differences between consecutive samples are
   * attributed to the later sample, so this recovers the sample a transition starts from.
   */
  public Condition orShiftedEarlier() {
    boolean[] result = Arrays.copyOf(mask, mask.length);
    for (int i = 0; i < mask.length - 1; i++) {
      result[i] = mask[i] || mask[i + 1];
    }
    return new Condition(result);
  }

  public int count() {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  public boolean none() {
    return count() == 0;
  }

  public boolean any() {
    return !none();
  }

  /** Index of the first true sample, or -1. */
  public int firstIndex() {
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        return i;
      }
    }
    return -1;
  }

  /** Index of the last true sample, or -1. */
  public int lastIndex() {
    for (int i = mask.length - 1; i >= 0; i--) {
      if (mask[i]) {
        return i;
      }
    }
    return -1;
  }

  public int[] indices() {
    int[] indices = new int[count()];
    int j = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        indices[j++] = i;
      }
    }
    return indices;
  }

  private void checkSize(Condition other) {
    if (other.mask.length != mask.length) {
      throw new IllegalArgumentException(String.format(
          "Cannot combine conditions of sizes %d and %d", mask.length, other.mask.length));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(mask, ((Condition) o).mask);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(mask);
  }

  @Override
  public String toString() {
    return String.format("Condition{%d/%d samples}", count(), mask.length);
  }
}

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

package com.twentyn.sputterlog.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which power supplies were found driving a sputter source, in the order their channels were copied.  The last one
 * wins; more than one means the wiring changed during the run.
 */
public class SourceBinding {
  private final int source;
  private final List<Integer> supplies = new ArrayList<>();

  public SourceBinding(int source) {
    this.source = source;
  }

  void addSupply(int supply) {
    supplies.add(supply);
  }

  public int getSource() {
    return source;
  }

  public List<Integer> getSupplies() {
    return Collections.unmodifiableList(supplies);
  }

  public boolean isBound() {
    return !supplies.isEmpty();
  }

  public boolean isAmbiguous() {
    return supplies.size() > 1;
  }

  /** The supply whose channels ended up in the source namespace, or null. */
  public Integer getEffectiveSupply() {
    return supplies.isEmpty() ? null : supplies.get(supplies.size() - 1);
  }

  @Override
  public String toString() {
    return String.format("Source %d -> %s", source, supplies);
  }
}

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

package com.twentyn.sputterlog;

/**
 * The deposition condition could not be reduced to exactly one domain, even after dropping short domains and
 * re-extracting with the escalated continuity limit.  Picking one of the candidates would attribute the wrong window
 * to the deposition, so the whole log is rejected.
 */
public class DepositionUnicityException extends LogProcessingException {
  public static final String STAGE = "deposition";

  private final int domainCount;

  public DepositionUnicityException(String logName, int domainCount) {
    super(STAGE, logName, String.format(
        "expected exactly one deposition domain, found %d after continuity escalation", domainCount));
    this.domainCount = domainCount;
  }

  public int getDomainCount() {
    return domainCount;
  }
}

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
 * Raised when a sputter log cannot be turned into an event timeline.  The message always names the pipeline stage
 * that failed and the log file being processed.
 */
public class LogProcessingException extends Exception {
  private final String stage;
  private final String logName;

  public LogProcessingException(String stage, String logName, String detail) {
    super(String.format("[%s] %s: %s", stage, logName, detail));
    this.stage = stage;
    this.logName = logName;
  }

  public LogProcessingException(String stage, String logName, String detail, Throwable cause) {
    super(String.format("[%s] %s: %s", stage, logName, detail), cause);
    this.stage = stage;
    this.logName = logName;
  }

  public String getStage() {
    return stage;
  }

  public String getLogName() {
    return logName;
  }
}

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

package com.twentyn.sputterlog.extract;

/**
 * Substrate temperature during the deposition, from the heater setpoint.  A setpoint that crosses the room
 * temperature threshold within one deposition is MIXED.
 */
public enum TemperatureRegime {
  ROOM_TEMPERATURE,
  HEATED,
  MIXED,
  ;

  /** The legacy "rt" flag, or null when the regime is mixed. */
  public Boolean isRoomTemperature() {
    switch (this) {
      case ROOM_TEMPERATURE:
        return Boolean.TRUE;
      case HEATED:
        return Boolean.FALSE;
      default:
        return null;
    }
  }
}

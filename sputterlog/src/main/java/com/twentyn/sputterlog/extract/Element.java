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

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Elements that sputter targets and reactive gases in the chamber are made of.  Operators type target materials
 * either as a symbol ("Cu") or a name ("Copper"); both resolve here.
 */
public enum Element {
  HYDROGEN("H", "Hydrogen"),
  LITHIUM("Li", "Lithium"),
  BORON("B", "Boron"),
  CARBON("C", "Carbon"),
  NITROGEN("N", "Nitrogen"),
  OXYGEN("O", "Oxygen"),
  SODIUM("Na", "Sodium"),
  MAGNESIUM("Mg", "Magnesium"),
  ALUMINIUM("Al", "Aluminium"),
  SILICON("Si", "Silicon"),
  PHOSPHORUS("P", "Phosphorus"),
  SULFUR("S", "Sulfur"),
  POTASSIUM("K", "Potassium"),
  CALCIUM("Ca", "Calcium"),
  SCANDIUM("Sc", "Scandium"),
  TITANIUM("Ti", "Titanium"),
  VANADIUM("V", "Vanadium"),
  CHROMIUM("Cr", "Chromium"),
  MANGANESE("Mn", "Manganese"),
  IRON("Fe", "Iron"),
  COBALT("Co", "Cobalt"),
  NICKEL("Ni", "Nickel"),
  COPPER("Cu", "Copper"),
  ZINC("Zn", "Zinc"),
  GALLIUM("Ga", "Gallium"),
  GERMANIUM("Ge", "Germanium"),
  ARSENIC("As", "Arsenic"),
  SELENIUM("Se", "Selenium"),
  STRONTIUM("Sr", "Strontium"),
  YTTRIUM("Y", "Yttrium"),
  ZIRCONIUM("Zr", "Zirconium"),
  NIOBIUM("Nb", "Niobium"),
  MOLYBDENUM("Mo", "Molybdenum"),
  RUTHENIUM("Ru", "Ruthenium"),
  PALLADIUM("Pd", "Palladium"),
  SILVER("Ag", "Silver"),
  CADMIUM("Cd", "Cadmium"),
  INDIUM("In", "Indium"),
  TIN("Sn", "Tin"),
  ANTIMONY("Sb", "Antimony"),
  TELLURIUM("Te", "Tellurium"),
  BARIUM("Ba", "Barium"),
  LANTHANUM("La", "Lanthanum"),
  CERIUM("Ce", "Cerium"),
  HAFNIUM("Hf", "Hafnium"),
  TANTALUM("Ta", "Tantalum"),
  TUNGSTEN("W", "Tungsten"),
  PLATINUM("Pt", "Platinum"),
  GOLD("Au", "Gold"),
  LEAD("Pb", "Lead"),
  BISMUTH("Bi", "Bismuth"),
  ;

  private static final Map<String, Element> BY_SYMBOL = new HashMap<>();
  private static final Map<String, Element> BY_NAME = new HashMap<>();

  static {
    for (Element e : values()) {
      BY_SYMBOL.put(e.symbol, e);
      BY_NAME.put(e.name.toLowerCase(), e);
    }
    // US spelling and the older English spelling of sulfur.
    BY_NAME.put("aluminum", ALUMINIUM);
    BY_NAME.put("sulphur", SULFUR);
  }

  private final String symbol;
  private final String name;

  Element(String symbol, String name) {
    this.symbol = symbol;
    this.name = name;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getName() {
    return name;
  }

  /**
   * Resolves a symbol (case sensitive, "Sn" but not "SN") or a name (case insensitive).
   *
   * @return the element, or null if the text names none
   */
  public static Element lookup(String text) {
    String trimmed = StringUtils.trimToNull(text);
    if (trimmed == null) {
      return null;
    }
    Element bySymbol = BY_SYMBOL.get(trimmed);
    return bySymbol != null ? bySymbol : BY_NAME.get(trimmed.toLowerCase());
  }

  public static Element fromSymbol(String symbol) {
    Element e = BY_SYMBOL.get(symbol);
    if (e == null) {
      throw new IllegalArgumentException(String.format("Unknown element symbol '%s'", symbol));
    }
    return e;
  }
}

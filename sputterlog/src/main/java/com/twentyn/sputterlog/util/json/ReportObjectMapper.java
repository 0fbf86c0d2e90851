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

package com.twentyn.sputterlog.util.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;

public class ReportObjectMapper {
  private ReportObjectMapper() {
  }

  /** A mapper that knows the Joda types found in reports, writing indented output. */
  public static ObjectMapper create() {
    SimpleModule jodaTypes = new SimpleModule("sputterlog-joda");
    jodaTypes.addSerializer(LocalDateTime.class, new LocalDateTimeSerde.LocalDateTimeSerializer());
    jodaTypes.addDeserializer(LocalDateTime.class, new LocalDateTimeSerde.LocalDateTimeDeserializer());
    jodaTypes.addSerializer(Duration.class, new DurationSerde.DurationSerializer());
    jodaTypes.addDeserializer(Duration.class, new DurationSerde.DurationDeserializer());

    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(jodaTypes);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    return mapper;
  }
}

/**
 * bitingest: Bitmap Index Ingestion.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of bitingest.
 *
 * bitingest is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.bitingest.config;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotate a field of a bean with this annotation to get the configuration value of the given {@link ConfigKey} wired
 * into it.
 *
 * @see ConfigurationPostProcessor
 * @author Bastian Gloeckle
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Config {
  /**
   * The config key, see {@link ConfigKey}.
   */
  String value();
}

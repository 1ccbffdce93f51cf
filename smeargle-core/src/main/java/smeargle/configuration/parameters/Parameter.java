/* 
 * Copyright (C) 2026 the SMEARGLE developers
 *
 * This File is part of SMEARGLE
 *
 * SMEARGLE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SMEARGLE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SMEARGLE.  If not, see <http://www.gnu.org/licenses/>.
 */
package smeargle.configuration.parameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.utils.JSONSerializable;

import java.util.function.Predicate;

/**
 * Named, validated, JSON-serializable plugin parameter
 * @author SMEARGLE developers
 */
public interface Parameter<P extends Parameter<P>> extends JSONSerializable {
    public static final Logger logger = LoggerFactory.getLogger(Parameter.class);
    public String getName();
    public void setName(String name);
    public String getHintText();
    public P setHint(String tip);
    public P addValidationFunction(Predicate<P> validationFunction);
    public boolean isValid();
    public boolean sameContent(Parameter other);
    public void setContentFrom(Parameter other);
    public P duplicate();
}

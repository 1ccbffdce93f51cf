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
package smeargle.configuration;

import org.json.simple.JSONObject;
import smeargle.configuration.parameters.BoundedNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.core.ConfigurationException;
import smeargle.utils.JSONSerializable;
import smeargle.utils.JSONUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Constants shared by all plugins of a run
 * @author SMEARGLE developers
 */
public class RuntimeConfiguration implements JSONSerializable {
    public final static double DEFAULT_FLOAT_EQUALITY_TOLERANCE = 1e-8;
    BoundedNumberParameter floatEqualityTolerance = new BoundedNumberParameter("FLOAT_EQUALITY_TOLERANCE", 20, DEFAULT_FLOAT_EQUALITY_TOLERANCE, 0, null).setHint("Absolute tolerance used when comparing floating point values for equality");
    List<Parameter> parameters = Arrays.asList(floatEqualityTolerance);

    public double getFloatEqualityTolerance() {
        return floatEqualityTolerance.getDoubleValue();
    }

    public RuntimeConfiguration setFloatEqualityTolerance(double tolerance) {
        floatEqualityTolerance.setValue(tolerance);
        return this;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public Object toJSONEntry() {
        return JSONUtils.toJSONMap(parameters);
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new ConfigurationException("Runtime configuration must be a JSON object, got: "+jsonEntry);
        Set<String> unknown;
        try {
            unknown = JSONUtils.fromJSONMap(parameters, (JSONObject)jsonEntry);
        } catch (IllegalArgumentException|ClassCastException e) {
            throw new ConfigurationException("Invalid runtime configuration: "+jsonEntry, e);
        }
        if (!unknown.isEmpty()) throw new ConfigurationException("Unknown runtime configuration keys: "+unknown);
        for (Parameter p : parameters) if (!p.isValid()) throw new ConfigurationException("Invalid runtime configuration value: "+p);
    }
}

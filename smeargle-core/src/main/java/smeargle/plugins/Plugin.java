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
package smeargle.plugins;

import smeargle.configuration.parameters.Parameter;
import smeargle.core.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 *
 * @author SMEARGLE developers
 */
public interface Plugin {
    /**
     *
     * @return parameters of this plugin, named like the configuration keys
     */
    public Parameter[] getParameters();

    /**
     *
     * @param name
     * @return parameter named {@param name}, null if none
     */
    public default Parameter getParameter(String name) {
        return Arrays.stream(getParameters()).filter(p -> p.getName().equals(name)).findFirst().orElse(null);
    }

    /**
     * @throws ConfigurationException listing invalid parameters
     */
    public default void checkParameters() {
        String invalid = Arrays.stream(getParameters()).filter(p -> !p.isValid()).map(Object::toString).collect(Collectors.joining(", "));
        if (!invalid.isEmpty()) throw new ConfigurationException("Invalid parameter(s) for "+PluginFactory.getPluginName(getClass())+": "+invalid);
    }
}

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

/**
 *
 * @author SMEARGLE developers
 */
public class BooleanParameter extends ParameterImpl<BooleanParameter> {
    boolean selected;

    public BooleanParameter(String name) {
        this(name, false);
    }
    
    public BooleanParameter(String name, boolean defaultValue) {
        super(name);
        this.selected = defaultValue;
    }

    public boolean getSelected() {
        return selected;
    }
    
    public BooleanParameter setSelected(boolean selected){
        this.selected = selected;
        return this;
    }

    @Override
    public boolean sameContent(Parameter other) {
        return other instanceof BooleanParameter && ((BooleanParameter)other).selected==selected;
    }

    @Override
    public void setContentFrom(Parameter other) {
        if (other instanceof BooleanParameter) this.selected = ((BooleanParameter)other).selected;
        else throw new IllegalArgumentException("wrong parameter type");
    }

    @Override public BooleanParameter duplicate() {
        BooleanParameter res = new BooleanParameter(name, selected);
        copyAttributesTo(res);
        return res;
    }

    @Override
    public Object toJSONEntry() {
        return selected;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        if (json instanceof Boolean) selected = (Boolean)json;
        else if ("true".equals(json) || "false".equals(json)) selected = "true".equals(json);
        else throw new IllegalArgumentException("Parameter "+name+": JSON Entry is not a boolean: "+json);
    }

    @Override
    public String toString() {
        return name+": "+selected;
    }
}

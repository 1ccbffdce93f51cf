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

import org.json.simple.JSONArray;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Variable number of parameters built from a child template
 * @author SMEARGLE developers
 */
public class ListParameter<T extends Parameter<T>> extends ParameterImpl<ListParameter<T>> {
    protected final T childInstance;
    protected List<T> children = new ArrayList<>();

    public ListParameter(String name, T childInstance) {
        super(name);
        this.childInstance = childInstance;
    }

    public T createChildInstance() {
        T res = childInstance.duplicate();
        res.setName(Integer.toString(children.size()));
        return res;
    }

    public T addChild() {
        T res = createChildInstance();
        children.add(res);
        return res;
    }

    public List<T> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    @Override
    public boolean isValid() {
        return children.stream().allMatch(Parameter::isValid) && super.isValid();
    }

    @Override
    public boolean sameContent(Parameter other) {
        if (!(other instanceof ListParameter)) return false;
        List<Parameter> otherChildren = ((ListParameter)other).children;
        if (otherChildren.size()!=children.size()) return false;
        for (int i = 0; i<children.size(); ++i) if (!children.get(i).sameContent(otherChildren.get(i))) return false;
        return true;
    }

    @Override
    public void setContentFrom(Parameter other) {
        if (!(other instanceof ListParameter)) throw new IllegalArgumentException("wrong parameter type");
        children.clear();
        for (Object o : ((ListParameter)other).children) addChild().setContentFrom((Parameter)o);
    }

    @Override
    public ListParameter<T> duplicate() {
        ListParameter<T> res = new ListParameter<>(name, childInstance);
        res.setContentFrom(this);
        copyAttributesTo(res);
        return res;
    }

    @Override
    public Object toJSONEntry() {
        JSONArray res = new JSONArray();
        for (T c : children) res.add(c.toJSONEntry());
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof List)) throw new IllegalArgumentException("Could not initialize parameter "+name+" from: "+jsonEntry);
        children.clear();
        for (Object o : (List)jsonEntry) addChild().initFromJSONEntry(o);
    }

    @Override
    public String toString() {
        return name+": "+children.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}

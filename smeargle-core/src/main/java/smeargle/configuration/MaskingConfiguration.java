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

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.configuration.parameters.BooleanParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.core.ConfigurationException;
import smeargle.plugins.Masker;
import smeargle.plugins.PluginFactory;
import smeargle.plugins.RuntimeConfigurable;
import smeargle.utils.JSONSerializable;
import smeargle.utils.JSONUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered list of maskers to run, with their parameters, plus the runtime constants.
 * JSON layout:
 * <pre>
 * {"runtime": {"FLOAT_EQUALITY_TOLERANCE": 1e-8},
 *  "continue_on_error": false,
 *  "masks": [{"name": "filter_minimum_value", "parameters": {"minimum_value": 10}, "run": true}, ...]}
 * </pre>
 * @author SMEARGLE developers
 */
public class MaskingConfiguration implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(MaskingConfiguration.class);
    public final static String RUNTIME = "runtime", CONTINUE_ON_ERROR = "continue_on_error", MASKS = "masks", NAME = "name", PARAMETERS = "parameters", RUN = "run";
    final List<MaskerEntry> entries = new ArrayList<>();
    RuntimeConfiguration runtimeConfiguration = new RuntimeConfiguration();
    BooleanParameter continueOnError = new BooleanParameter(CONTINUE_ON_ERROR, false).setHint("Keep running the remaining maskers and images when one fails; failures are reported together");

    public static class MaskerEntry {
        final String name;
        final Masker masker;
        boolean run;
        MaskerEntry(String name, Masker masker, boolean run) {
            this.name = name;
            this.masker = masker;
            this.run = run;
        }
        public String getName() {
            return name;
        }
        public Masker getMasker() {
            return masker;
        }
        public boolean isRun() {
            return run;
        }
        public MaskerEntry setRun(boolean run) {
            this.run = run;
            return this;
        }
        JSONObject toJSONEntry() {
            JSONObject res = new JSONObject();
            res.put(NAME, name);
            res.put(PARAMETERS, JSONUtils.toJSONMap(Arrays.asList(masker.getParameters())));
            res.put(RUN, run);
            return res;
        }
        @Override
        public String toString() {
            return name + (run ? "" : " (disabled)");
        }
    }

    /**
     * Appends a masker instance
     * @param masker registered masker
     * @return the new entry
     */
    public MaskerEntry add(Masker masker) {
        String name = PluginFactory.getPluginName(masker.getClass());
        if (name==null) throw new ConfigurationException("Masker "+masker.getClass().getSimpleName()+" is not registered");
        MaskerEntry e = new MaskerEntry(name, masker, true);
        entries.add(e);
        return e;
    }

    /**
     * Appends a new instance of the masker registered as {@param name}, with default parameters
     * @param name registry name
     * @return the new entry
     */
    public MaskerEntry add(String name) {
        Masker masker = PluginFactory.getPlugin(Masker.class, name);
        if (masker==null) throw new ConfigurationException("Unknown masker: "+name+", available: "+PluginFactory.getPluginNames(Masker.class));
        MaskerEntry e = new MaskerEntry(name, masker, true);
        entries.add(e);
        return e;
    }

    public List<MaskerEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     *
     * @return maskers to run, in order, each bound to the runtime configuration
     */
    public List<Masker> getMaskersToRun() {
        List<Masker> res = entries.stream().filter(MaskerEntry::isRun).map(MaskerEntry::getMasker).collect(Collectors.toList());
        for (Masker m : res) if (m instanceof RuntimeConfigurable) ((RuntimeConfigurable)m).setRuntimeConfiguration(runtimeConfiguration);
        return res;
    }

    public RuntimeConfiguration getRuntimeConfiguration() {
        return runtimeConfiguration;
    }

    public boolean isContinueOnError() {
        return continueOnError.getSelected();
    }

    public MaskingConfiguration setContinueOnError(boolean continueOnError) {
        this.continueOnError.setSelected(continueOnError);
        return this;
    }

    @Override
    public Object toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put(RUNTIME, runtimeConfiguration.toJSONEntry());
        res.put(CONTINUE_ON_ERROR, continueOnError.toJSONEntry());
        JSONArray masks = new JSONArray();
        for (MaskerEntry e : entries) masks.add(e.toJSONEntry());
        res.put(MASKS, masks);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new ConfigurationException("Masking configuration must be a JSON object, got: "+jsonEntry);
        JSONObject json = (JSONObject)jsonEntry;
        Set<Object> unknown = new HashSet<>(json.keySet());
        unknown.removeAll(Arrays.asList(RUNTIME, CONTINUE_ON_ERROR, MASKS));
        if (!unknown.isEmpty()) throw new ConfigurationException("Unknown masking configuration keys: "+unknown);
        RuntimeConfiguration runtime = new RuntimeConfiguration();
        if (json.containsKey(RUNTIME)) runtime.initFromJSONEntry(json.get(RUNTIME));
        BooleanParameter cont = continueOnError.duplicate().setSelected(false);
        try {
            if (json.containsKey(CONTINUE_ON_ERROR)) cont.initFromJSONEntry(json.get(CONTINUE_ON_ERROR));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid masking configuration", e);
        }
        Object masks = json.getOrDefault(MASKS, new JSONArray());
        if (!(masks instanceof List)) throw new ConfigurationException(MASKS+" must be a list, got: "+masks);
        List<MaskerEntry> newEntries = new ArrayList<>();
        for (Object o : (List)masks) newEntries.add(parseEntry(o));
        // only modify this instance once the whole document is valid
        this.runtimeConfiguration = runtime;
        this.continueOnError = cont;
        this.entries.clear();
        this.entries.addAll(newEntries);
    }

    private static MaskerEntry parseEntry(Object o) {
        if (!(o instanceof JSONObject)) throw new ConfigurationException("Masker entry must be a JSON object, got: "+o);
        JSONObject json = (JSONObject)o;
        Object name = json.get(NAME);
        if (!(name instanceof String)) throw new ConfigurationException("Masker entry without name: "+json);
        Masker masker = PluginFactory.getPlugin(Masker.class, (String)name);
        if (masker==null) throw new ConfigurationException("Unknown masker: "+name+", available: "+PluginFactory.getPluginNames(Masker.class));
        Object params = json.getOrDefault(PARAMETERS, new JSONObject());
        if (!(params instanceof JSONObject)) throw new ConfigurationException("Parameters of "+name+" must be a JSON object, got: "+params);
        List<Parameter> parameters = Arrays.asList(masker.getParameters());
        Set<String> unknown;
        try {
            unknown = JSONUtils.fromJSONMap(parameters, (JSONObject)params);
        } catch (IllegalArgumentException|ClassCastException e) {
            throw new ConfigurationException("Invalid parameters for "+name+": "+params, e);
        }
        if (!unknown.isEmpty()) throw new ConfigurationException("Unknown parameter(s) for "+name+": "+unknown+", expected: "+parameters.stream().map(Parameter::getName).collect(Collectors.toList()));
        Object run = json.getOrDefault(RUN, true);
        if (!(run instanceof Boolean)) throw new ConfigurationException(RUN+" of "+name+" must be a boolean, got: "+run);
        if ((Boolean)run) masker.checkParameters();
        logger.debug("configured masker: {} with parameters: {}", name, parameters);
        return new MaskerEntry((String)name, masker, (Boolean)run);
    }

    public static MaskingConfiguration fromJSON(String json) {
        MaskingConfiguration res = new MaskingConfiguration();
        try {
            res.initFromJSONEntry(JSONUtils.parse(json));
        } catch (ParseException|ClassCastException e) {
            throw new ConfigurationException("Malformed masking configuration: "+json, e);
        }
        return res;
    }

    public String toJSONString() {
        return JSONUtils.serialize(this);
    }
}

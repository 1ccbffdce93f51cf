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
package smeargle.utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;
import smeargle.configuration.parameters.Parameter;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 *
 * @author SMEARGLE developers
 */
public class JSONUtils {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) res[i] = ((Number)array.get(i)).doubleValue();
        return res;
    }
    public static long[] fromLongArray(List array) {
        long[] res = new long[array.size()];
        for (int i = 0; i<res.length; ++i) res[i] = ((Number)array.get(i)).longValue();
        return res;
    }
    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArray(long[] array) {
        JSONArray res = new JSONArray();
        for (long d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArray(int[] array) {
        JSONArray res = new JSONArray();
        for (int d : array) res.add(d);
        return res;
    }
    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        return (JSONObject)res;
    }

    public static JSONObject toJSONMap(Collection<? extends Parameter> coll) {
        JSONObject res = new JSONObject();
        for (Parameter j : coll) res.put(j.getName(), j.toJSONEntry());
        return res;
    }
    /**
     * Sets parameters of {@param list} from the entries of {@param json} with the same name
     * @param list
     * @param json
     * @return names present in {@param json} that match no parameter
     */
    public static <P extends Parameter> Set<String> fromJSONMap(List<P> list, JSONObject json) {
        if (json==null || json.isEmpty()) return Collections.emptySet();
        Map<String, P> recieveMap = list.stream().collect(Collectors.toMap(Parameter::getName, Function.identity()));
        Set<String> unknown = new TreeSet<>();
        for (Object k : json.keySet()) {
            String s = (String)k;
            if (recieveMap.containsKey(s)) recieveMap.get(s).initFromJSONEntry(json.get(s));
            else unknown.add(s);
        }
        return unknown;
    }
}

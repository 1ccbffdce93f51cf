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
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.junit.Test;
import smeargle.utils.JSONUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class ParameterTest {

    @Test
    public void testBoundedNumber() {
        BoundedNumberParameter p = new BoundedNumberParameter("top_count", 0, 0, 0, null);
        assertTrue(p.isValid());
        p.setValue(-1);
        assertFalse("lower bound", p.isValid());
        p.setValue(2.5);
        assertFalse("integer", p.isValid());
        assertFalse("no value", new BoundedNumberParameter("minimum_value", 8, null).isValid());
        BoundedNumberParameter width = new BoundedNumberParameter("bin_width", 8, 0, 0, null).addValidationFunction(b -> b.getDoubleValue() > 0);
        assertFalse("additional validation", width.isValid());
        assertFalse("additional validation kept by duplicate", width.duplicate().isValid());
    }

    @Test
    public void testInterval() {
        IntervalParameter p = new IntervalParameter("column_range", 0, 0, null, 2, 4);
        assertTrue(p.isValid());
        assertArrayEquals(new int[]{2, 4}, p.getValuesAsInt());
        p.setValues(4, 2);
        assertFalse("first > last", p.isValid());
        p.setValues(-1, 2);
        assertFalse("lower bound", p.isValid());
        IntervalParameter missing = new IntervalParameter("row_range", 0, 0, null, new Number[]{null, null});
        assertFalse("missing values", missing.isValid());
        assertNull(missing.getValues()[1]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIntervalLength() {
        new IntervalParameter("column_range", 0, 0, null, 2, 4).initFromJSONEntry(JSONUtils.toJSONArray(new int[]{1, 2, 3}));
    }

    @Test
    public void testArrayNumber() {
        ArrayNumberParameter p = new ArrayNumberParameter("sigma_multiple", 1, 2, 5, 0, null);
        assertFalse("empty", p.isValid());
        p.initFromJSONEntry(3.0);
        assertTrue("single number", p.isValid());
        assertArrayEquals(new double[]{3}, p.getArrayDouble(), 0);
        p.setValue(new int[]{1, 2, 3});
        assertFalse("too long", p.isValid());
        p.setValue(new double[]{-1});
        assertFalse("negative", p.isValid());
    }

    @Test
    public void testList() {
        ListParameter<IntervalParameter> list = new ListParameter<>("column_ranges", new IntervalParameter("column_range", 0, 0, null, new Number[]{null, null}));
        list.addChild().setValues(0, 1);
        list.addChild().setValues(3, 5);
        assertTrue(list.isValid());
        ListParameter<IntervalParameter> copy = list.duplicate();
        assertTrue(copy.sameContent(list));
        copy.initFromJSONEntry(list.toJSONEntry());
        assertEquals(2, copy.getChildCount());
        assertArrayEquals(new int[]{3, 5}, copy.getChildren().get(1).getValuesAsInt());
    }

    @Test
    public void testJSONMap() throws ParseException {
        BoundedNumberParameter top = new BoundedNumberParameter("top_count", 0, 0, 0, null);
        ArrayNumberParameter rows = new ArrayNumberParameter("rows", 1, -1, 0, 0, null, 1, 2);
        BooleanParameter run = new BooleanParameter("run", true);
        List<Parameter> parameters = Arrays.asList(top, rows, run);
        JSONObject json = JSONUtils.parse(JSONUtils.toJSONMap(parameters).toJSONString());
        json.put("top_count", 5L);
        json.put("run", "false");
        json.put("unknown", 1L);
        Set<String> unknown = JSONUtils.fromJSONMap(parameters, json);
        assertEquals(1, unknown.size());
        assertTrue(unknown.contains("unknown"));
        assertEquals(5, top.getIntValue());
        assertArrayEquals(new int[]{1, 2}, rows.getArrayInt());
        assertFalse(run.getSelected());
        assertTrue(json.get("rows") instanceof JSONArray);
    }
}

/* @LICENSE@
 */

package org.xtgraph.graph;

import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;

public class PropertyMapTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PropertyMapTestCase.class);
    }

    public PropertyMapTestCase(String name) {
        super(name);
    }

    public void testArrayRequired() {
        ArrayPropertyMap<String> pm = ArrayPropertyMap.required();
        pm.put(2, "two");
        assertEquals("two", pm.get(2));
        assertTrue(pm.has(2));
        assertFalse(pm.has(0));
        assertFalse(pm.has(7));
        try {
            pm.get(0);
            fail();
        } catch (KeyNotFoundException e) {
            assertEquals(0, e.key());
        }
        try {
            pm.get(7);
            fail();
        } catch (KeyNotFoundException e) {
            assertEquals(7, e.key());
        }
    }

    public void testArrayDefault() {
        ArrayPropertyMap<Color> pm = ArrayPropertyMap.withDefault(Color.WHITE);
        assertEquals(Color.WHITE, pm.get(5));
        assertFalse(pm.has(5));
        pm.put(5, Color.BLACK);
        assertEquals(Color.BLACK, pm.get(5));
        assertEquals(Color.WHITE, pm.get(4));
    }

    public void testArrayRejectsNegativeKey() {
        try {
            ArrayPropertyMap.<String>required().put(-1, "x");
            fail();
        } catch (IllegalArgumentException e) {
            // ok
        }
    }

    public void testAssoc() {
        AssocPropertyMap<String, Integer> required = AssocPropertyMap.required();
        required.put("a", 1);
        required.put("n", null);
        assertEquals(Integer.valueOf(1), required.get("a"));
        assertNull(required.get("n"));
        try {
            required.get("b");
            fail();
        } catch (KeyNotFoundException e) {
            assertEquals("b", e.key());
        }

        AssocPropertyMap<String, Integer> optional = AssocPropertyMap.withDefault(null);
        assertNull(optional.get("b"));
        assertFalse(optional.has("b"));
    }

    public void testWrapWritesThrough() {
        Map<Character, String> labels = new HashMap<Character, String>();
        AssocPropertyMap<Character, String> pm = AssocPropertyMap.wrap(labels, "?");
        pm.put('a', "alpha");
        assertEquals("alpha", labels.get('a'));
        assertEquals("?", pm.get('b'));
        assertEquals(1, pm.size());
    }

    public void testReadOnlyMaps() {
        PropertyMap<Integer, String> constant = PropertyMaps.constant("x");
        assertEquals("x", constant.get(42));
        assertTrue(constant.has(42));

        PropertyMap<Integer, Integer> identity = PropertyMaps.identity();
        assertEquals(Integer.valueOf(3), identity.get(3));

        PropertyMap<Integer, Integer> square = PropertyMaps.of(new PropertyMaps.Function<Integer, Integer>() {
            public Integer apply(Integer key) {
                return key * key;
            }
        });
        assertEquals(Integer.valueOf(9), square.get(3));
    }
}

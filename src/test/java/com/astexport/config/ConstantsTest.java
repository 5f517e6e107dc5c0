package com.astexport.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals("terminal", Constants.TERMINAL_TYPE);
        assertEquals(10, Constants.DEFAULT_SAMPLE_SIZE);
        assertEquals(1000, Constants.MAX_SAMPLE_SIZE);
        assertTrue(Constants.DEFAULT_SAMPLE_SIZE <= Constants.MAX_SAMPLE_SIZE);
        assertEquals(1000, Constants.MAX_TREE_DEPTH);
        assertEquals(2 * Constants.MAX_TREE_DEPTH + 1, Constants.MAX_JSON_NESTING_DEPTH);
        assertEquals("(source_file", Constants.DEFAULT_ROOT_PREFIX);
        assertEquals("ast.json", Constants.DEFAULT_OUTPUT_FILE);
        assertEquals("-", Constants.STDIN_MARKER);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}

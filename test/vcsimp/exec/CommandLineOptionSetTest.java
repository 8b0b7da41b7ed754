package vcsimp.exec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class CommandLineOptionSetTest {

    private CommandLineOptionSet makeOptions() {
        CommandLineOptionSet options = new CommandLineOptionSet();
        options.add(options.UTILITY, "help", "Print this message");
        options.add(options.SIMPLIFY, "spec-mode", "1", "0|1", "Spec rules");
        options.add(options.SIMPLIFY, "limit", "N", "Some limit");
        return options;
    }

    @Test
    public void testValues() {
        CommandLineOptionSet options = makeOptions();
        assertTrue(options.contains("help"));
        assertFalse(options.contains("verbosity"));
        assertNull(options.getValue("help"));
        assertEquals("1", options.getValue("spec-mode"));
        assertNull(options.getValue("limit"));
        options.setValue("limit", "5");
        assertEquals("5", options.getValue("limit"));
        options.setValue("missing", "5");
        assertNull(options.getValue("missing"));
        assertEquals(options.SIMPLIFY, options.getType("spec-mode"));
        assertEquals(0, options.getType("missing"));
    }

    @Test
    public void testUsageGroupsByCategory() {
        CommandLineOptionSet options = makeOptions();
        String simplify = options.getUsage(options.SIMPLIFY);
        assertTrue(simplify.contains("-spec-mode=0|1"));
        assertTrue(simplify.contains("-limit=N"));
        assertFalse(simplify.contains("-help"));
        assertTrue(options.getUsage().contains("UTILITY"));
    }

    @Test
    public void testDumpCommentsOutFlags() {
        String dump = makeOptions().dumpOptions();
        assertTrue(dump.contains("\n#help\n"));
        assertTrue(dump.contains("\nspec-mode=1\n"));
        assertTrue(dump.contains("\nlimit\n"));
    }
}

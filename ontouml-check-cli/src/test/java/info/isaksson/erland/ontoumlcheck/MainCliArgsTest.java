package info.isaksson.erland.ontoumlcheck;

import info.isaksson.erland.ontoumlcheck.core.ValidationOptions;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void defaultsMatchTheValidateTab() {
        Main.CliArgs args = Main.CliArgs.parse(new String[] {"model.json"});

        assertEquals("model.json", args.model);
        assertTrue(args.errors);
        assertFalse(args.antipatterns);
        assertFalse(args.failOnProblems);
        assertTrue(args.disabled.isEmpty());
    }

    @Test
    void parsesEveryFlag() {
        Main.CliArgs args = Main.CliArgs.parse(new String[] {
                "--model", "m.json",
                "--errors", "no",
                "--antipatterns", "1",
                "--disable", "BinOver",
                "--disable=undef_phase",
                "--report", "out/report.md",
                "--fail-on-problems", "true",
                "--verbose"
        });

        assertEquals("m.json", args.model);
        assertFalse(args.errors);
        assertTrue(args.antipatterns);
        assertEquals(EnumSet.of(AntiPatternType.BIN_OVER, AntiPatternType.UNDEF_PHASE), args.disabled);
        assertEquals("out/report.md", args.report);
        assertTrue(args.failOnProblems);
        assertTrue(args.verbose);
    }

    @Test
    void disabledDetectorsAreRemovedFromOptions() {
        Main.CliArgs args = Main.CliArgs.parse(new String[] {"m.json", "--antipatterns", "true", "--disable", "FreeRole"});
        ValidationOptions options = Main.toOptions(args);

        assertTrue(options.checkAntipatterns);
        assertFalse(options.enabledAntiPatterns.contains(AntiPatternType.FREE_ROLE));
        assertEquals(AntiPatternType.values().length - 1, options.enabledAntiPatterns.size());
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--errors", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--model"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--disable", "NoSuchThing"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a.json", "b.json"}));
    }

    @Test
    void helpAndMissingModel() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--nope"}));
        assertEquals(1, Main.run(new String[] {"does-not-exist.json"}));
    }
}

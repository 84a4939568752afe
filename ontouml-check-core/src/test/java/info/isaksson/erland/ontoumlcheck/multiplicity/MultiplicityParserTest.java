package info.isaksson.erland.ontoumlcheck.multiplicity;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MultiplicityParserTest {

    @Test
    void parsesTheRangeForms() {
        assertEquals(Optional.of(new Multiplicity(1, Multiplicity.STAR)), MultiplicityParser.parse("1..*"));
        assertEquals(Optional.of(new Multiplicity(2, 2)), MultiplicityParser.parse("2"));
        assertEquals(Optional.of(new Multiplicity(0, Multiplicity.STAR)), MultiplicityParser.parse("*"));
        assertEquals(Optional.of(new Multiplicity(0, 5)), MultiplicityParser.parse(" 0 .. 5 "));
    }

    @Test
    void emptyIsAbsent() {
        assertEquals(Optional.empty(), MultiplicityParser.parse(""));
        assertEquals(Optional.empty(), MultiplicityParser.parse("   "));
        assertEquals(Optional.empty(), MultiplicityParser.parse(null));
    }

    @Test
    void rejectsMalformedText() {
        assertTrue(MultiplicityParser.parse("many").isEmpty());
        assertTrue(MultiplicityParser.parse("-1").isEmpty());
        assertTrue(MultiplicityParser.parse("1..").isEmpty());
        assertTrue(MultiplicityParser.parse("..3").isEmpty());
        assertTrue(MultiplicityParser.parse("*..1").isEmpty());
        assertTrue(MultiplicityParser.parse("1..2..3").isEmpty());
        assertTrue(MultiplicityParser.parse("99999999999").isEmpty());
    }

    @Test
    void reversedRangeParsesButIsInconsistent() {
        Multiplicity m = MultiplicityParser.parse("3..1").orElseThrow();
        assertEquals(3, m.lower);
        assertEquals(1, m.upper);
        assertFalse(m.isConsistent());
        assertTrue(MultiplicityParser.parse("3..*").orElseThrow().isConsistent());
    }

    @Test
    void exactlyOneHasTwoSpellings() {
        assertTrue(MultiplicityParser.parse("1").orElseThrow().isExactlyOne());
        assertTrue(MultiplicityParser.parse("1..1").orElseThrow().isExactlyOne());
        assertFalse(MultiplicityParser.parse("0..1").orElseThrow().isExactlyOne());
        assertEquals("1..*", MultiplicityParser.parse("1..*").orElseThrow().toString());
    }
}

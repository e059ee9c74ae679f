package nl.bytesoflife.kicadsexpr.fields;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static nl.bytesoflife.kicadsexpr.model.SNode.*;
import static org.junit.jupiter.api.Assertions.*;

class CoercionsTest {

    @Test
    void toDouble() {
        assertEquals(Optional.of(1.5), Coercions.toDouble(decimal(1.5)));
        assertEquals(Optional.of(2.0), Coercions.toDouble(integer(2)));
        assertEquals(Optional.of(-0.25), Coercions.toDouble(symbol("-0.25")));
        assertEquals(Optional.of(3.0), Coercions.toDouble(string(" 3 ")));
        assertEquals(Optional.empty(), Coercions.toDouble(symbol("0.127mm")));
        assertEquals(Optional.empty(), Coercions.toDouble(string("")));
        assertEquals(Optional.empty(), Coercions.toDouble(named("x", integer(1))));
    }

    @Test
    void toLongTruncatesFloats() {
        assertEquals(Optional.of(2L), Coercions.toLong(decimal(2.9)));
        assertEquals(Optional.of(-2L), Coercions.toLong(decimal(-2.9)));
        assertEquals(Optional.of(42L), Coercions.toLong(integer(42)));
        assertEquals(Optional.of(12L), Coercions.toLong(string("12")));
        assertEquals(Optional.empty(), Coercions.toLong(string("1.5")));
        assertEquals(Optional.empty(), Coercions.toLong(decimal(Double.NaN)));
        assertEquals(Optional.empty(), Coercions.toLong(decimal(1e30)));
        assertEquals(Optional.empty(), Coercions.toLong(symbol("99999999999999999999")));
    }

    @Test
    void toIntChecksRange() {
        assertEquals(Optional.of(7), Coercions.toInt(integer(7)));
        assertEquals(Optional.empty(), Coercions.toInt(integer(1L << 40)));
    }

    @Test
    void toStr() {
        assertEquals(Optional.of("GND"), Coercions.toStr(string("GND")));
        assertEquals(Optional.of("hide"), Coercions.toStr(symbol("hide")));
        assertEquals(Optional.of("5"), Coercions.toStr(integer(5)));
        assertEquals(Optional.of("2.0"), Coercions.toStr(decimal(2)));
        assertEquals(Optional.empty(), Coercions.toStr(list()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "true", "1", "YES"})
    void truthyValues(String text) {
        assertEquals(Optional.of(true), Coercions.toBool(symbol(text)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "false", "0"})
    void falsyValues(String text) {
        assertEquals(Optional.of(false), Coercions.toBool(symbol(text)));
    }

    @Test
    void unrecognizedBoolIsEmpty() {
        assertEquals(Optional.empty(), Coercions.toBool(symbol("maybe")));
        assertEquals(Optional.of(true), Coercions.toBool(integer(1)));
        assertEquals(Optional.empty(), Coercions.toBool(integer(2)));
        assertEquals(Optional.empty(), Coercions.toBool(list()));
    }
}

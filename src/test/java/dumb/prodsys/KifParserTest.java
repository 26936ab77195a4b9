package dumb.prodsys;

import dumb.prodsys.KifParser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KifParserTest {

    @Test
    void parsesListsAtomsAndVariables() throws ParseException {
        var terms = KifParser.parseKif("(enrolled ?s CS501) ; trailing comment\n(graduate-only CS501)");
        assertEquals(2, terms.size());
        var first = (Term.Lst) terms.get(0);
        assertEquals(Term.Atom.of("enrolled"), first.get(0));
        assertEquals(Term.Var.of("?s"), first.get(1));
        assertEquals("enrolled", first.op().orElseThrow());
        assertEquals("(enrolled ?s CS501)", first.toKif());
    }

    @Test
    void parsesQuotedStrings() throws ParseException {
        var t = (Term.Lst) KifParser.parseTerm("(title \"Intro to \\\"AI\\\"\" CS101)");
        assertEquals(Term.Atom.of("Intro to \"AI\""), t.get(1));
        assertEquals("(title \"Intro to \\\"AI\\\"\" CS101)", t.toKif());
    }

    @Test
    void reportsPositionOfErrors() {
        var e = assertThrows(ParseException.class, () -> KifParser.parseKif("(a b\n  (c d"));
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("EOF"), e.getMessage());
    }

    @Test
    void rejectsBadInput() {
        assertThrows(ParseException.class, () -> KifParser.parseKif("(a \"unterminated)"));
        assertThrows(ParseException.class, () -> KifParser.parseKif(")"));
        assertThrows(ParseException.class, () -> KifParser.parseKif("(a ?)"));
        assertThrows(ParseException.class, () -> KifParser.parseTerm("(a) (b)"));
    }

    @Test
    void emptyInputHasNoTerms() throws ParseException {
        assertEquals(List.of(), KifParser.parseKif("  ; only a comment\n"));
    }

    @Test
    void termsExposeJson() {
        var json = Term.Lst.of("enrolled", "?s", "CS501").toJson();
        assertEquals("list", json.getString("type"));
        assertEquals("var", json.getJSONArray("terms").getJSONObject(1).getString("type"));
        assertEquals("CS501", json.getJSONArray("terms").getJSONObject(2).getString("value"));
    }
}

package db.median.agg.value;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Comparator;
import org.junit.jupiter.api.Test;

public class CollationsTest {
    @Test
    void cCollationIsCodePointOrder() {
        Comparator<String> c = Collations.comparator("C");
        assertTrue(c.compare("B", "a") < 0);
        assertTrue(c.compare("a", "ab") < 0);
        assertEquals(0, c.compare("same", "same"));
        // U+1F600 is above U+FFFD in code points, although its first UTF-16 unit is below
        assertTrue(c.compare("\uFFFD", "\uD83D\uDE00") < 0);
        assertSame(c, Collations.comparator(null));
        assertSame(c, Collations.comparator("posix"));
    }

    @Test
    void localeCollationIgnoresCaseAtPrimaryLevel() {
        Comparator<String> en = Collations.comparator("en-US");
        assertTrue(en.compare("apple", "Banana") < 0);
        assertTrue(en.compare("Banana", "cherry") < 0);
        assertNotEquals(0, en.compare("a", "A"));
        assertEquals(0, en.compare("Zurich", "Zurich"));
    }

    @Test
    void underscoreTagsAreAccepted() {
        Comparator<String> en = Collations.comparator("en_US");
        assertTrue(en.compare("apple", "Banana") < 0);
    }

    @Test
    void malformedCollationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Collations.comparator("!!"));
    }

    @Test
    void wellFormedTagWithoutCollatorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Collations.comparator("zz-QQ"));
        assertNotNull(Collations.comparator("fr-CA"));
    }
}

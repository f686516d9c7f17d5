package db.median.agg.value;

import java.text.Collator;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves collation identifiers to string comparators.
 *   "C" / "POSIX"  -> code point order (same as byte order of the UTF-8 encoding)
 *   language tag   -> java.text.Collator for that locale, tertiary strength
 * A tag whose language has no installed collator is rejected.
 * Locale collations break ties by code point order, so two strings compare equal
 * only when they are identical.
 */
public final class Collations {
    public static final String C = "C";
    public static final String POSIX = "POSIX";

    private static final Comparator<String> CODE_POINT_ORDER = Collations::compareCodePoints;
    private static final Map<String, Comparator<String>> cache = new ConcurrentHashMap<>();
    private static final Set<String> LANGUAGES = availableLanguages();

    private Collations() {}

    /** Null or blank id means the C collation. */
    public static Comparator<String> comparator(String collationId) {
        if (collationId == null || collationId.isBlank()) return CODE_POINT_ORDER;
        String id = collationId.trim();
        if (id.equalsIgnoreCase(C) || id.equalsIgnoreCase(POSIX)) return CODE_POINT_ORDER;
        return cache.computeIfAbsent(id, Collations::localeComparator);
    }

    private static Comparator<String> localeComparator(String tag) {
        Locale locale = Locale.forLanguageTag(tag.replace('_', '-'));
        if (locale.getLanguage().isEmpty() || !LANGUAGES.contains(locale.getLanguage())) {
            throw new IllegalArgumentException("Unknown collation: " + tag);
        }
        Collator collator = Collator.getInstance(locale);
        collator.setStrength(Collator.TERTIARY);
        return (a, b) -> {
            int c = collator.compare(a, b);
            return c != 0 ? c : compareCodePoints(a, b);
        };
    }

    private static Set<String> availableLanguages() {
        Set<String> languages = new HashSet<>();
        for (Locale l : Collator.getAvailableLocales()) {
            if (!l.getLanguage().isEmpty()) languages.add(l.getLanguage());
        }
        return languages;
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}

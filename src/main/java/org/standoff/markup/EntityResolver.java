package org.standoff.markup;

import org.apache.commons.text.translate.AggregateTranslator;
import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.EntityArrays;
import org.apache.commons.text.translate.LookupTranslator;
import org.apache.commons.text.translate.NumericEntityUnescaper;

import java.io.IOException;
import java.io.Writer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves entity and character references to single characters.
 * <p>
 * Known entities are the HTML 4 set, the XML {@code apos} entity and the Latin-2
 * extension entities found in older corpus material. Control codes (below {@code 0x20} and
 * {@code 0x80..0x9F}) are never resolved.
 */
public final class EntityResolver {

    private static final Map<String, Integer> ENTITIES;
    private static final CharSequenceTranslator UNESCAPE;

    static {
        Map<String, Integer> entities = new HashMap<>();
        addAll(entities, EntityArrays.BASIC_UNESCAPE);
        addAll(entities, EntityArrays.ISO8859_1_UNESCAPE);
        addAll(entities, EntityArrays.HTML40_EXTENDED_UNESCAPE);
        addAll(entities, EntityArrays.APOS_UNESCAPE);

        // Latin-2 (ISO 8859-2) extensions
        entities.put("Aogon", 260);
        entities.put("breve", 728);
        entities.put("Lstrok", 321);
        entities.put("Lcaron", 317);
        entities.put("Sacute", 346);
        entities.put("Scaron", 352);
        entities.put("Scedil", 350);
        entities.put("Tcaron", 356);
        entities.put("Zacute", 377);
        entities.put("Zcaron", 381);
        entities.put("Zdot", 379);
        entities.put("aogon", 261);
        entities.put("ogon", 731);
        entities.put("lstrok", 322);
        entities.put("lcaron", 318);
        entities.put("sacute", 347);
        entities.put("caron", 711);
        entities.put("scaron", 353);
        entities.put("scedil", 351);
        entities.put("tcaron", 357);
        entities.put("zacute", 378);
        entities.put("dblac", 733);
        entities.put("zcaron", 382);
        entities.put("zdot", 380);
        entities.put("Racute", 340);
        entities.put("Abreve", 258);
        entities.put("Lacute", 313);
        entities.put("Cacute", 262);
        entities.put("Ccaron", 268);
        entities.put("Eogon", 280);
        entities.put("Ecaron", 282);
        entities.put("Dcaron", 270);
        entities.put("Dstrok", 272);
        entities.put("Nacute", 323);
        entities.put("Ncaron", 327);
        entities.put("Odblac", 336);
        entities.put("Rcaron", 344);
        entities.put("Uring", 366);
        entities.put("Udblac", 368);
        entities.put("Tcedil", 354);
        entities.put("racute", 341);
        entities.put("abreve", 259);
        entities.put("lacute", 314);
        entities.put("cacute", 263);
        entities.put("ccaron", 269);
        entities.put("eogon", 281);
        entities.put("ecaron", 283);
        entities.put("dcaron", 271);
        entities.put("dstrok", 273);
        entities.put("nacute", 324);
        entities.put("ncaron", 328);
        entities.put("odblac", 337);
        entities.put("rcaron", 345);
        entities.put("uring", 367);
        entities.put("udblac", 369);
        entities.put("tcedil", 355);
        entities.put("dot", 729);
        entities.put("cir", 9675);
        ENTITIES = Collections.unmodifiableMap(entities);

        Map<CharSequence, CharSequence> lookup = new HashMap<>();
        ENTITIES.forEach((name, code) -> lookup.put("&" + name + ";", new String(Character.toChars(code))));
        UNESCAPE = new AggregateTranslator(
                new UnresolvableReferenceKeeper(),
                new LookupTranslator(lookup),
                new NumericEntityUnescaper());
    }

    private EntityResolver() {
        // Private constructor to prevent instantiation
    }

    private static void addAll(Map<String, Integer> target, Map<CharSequence, CharSequence> unescape) {
        unescape.forEach((escaped, character) -> {
            String key = escaped.toString();
            String name = key.substring(1, key.length() - 1);
            target.put(name, Character.codePointAt(character, 0));
        });
    }

    /**
     * Checks whether a code point is a control code that must not enter the corpus text.
     * @param codePoint The code point.
     * @return {@code true} for codes below {@code 0x20} and in {@code 0x80..0x9F}.
     */
    public static boolean isControlCode(int codePoint) {
        return codePoint < 0x20 || (codePoint >= 0x80 && codePoint < 0xA0);
    }

    /**
     * Looks up a named entity.
     * @param name The entity name without {@code &} and {@code ;}.
     * @return The code point, or {@code null} if the entity is unknown.
     */
    public static Integer entity(String name) {
        return ENTITIES.get(name);
    }

    /**
     * Parses a numeric character reference.
     * @param reference Decimal digits, or {@code x} followed by hex digits.
     * @return The code point, or {@code null} if the reference is not a valid code point.
     */
    public static Integer characterReference(String reference) {
        try {
            int code;
            if (reference.startsWith("x") || reference.startsWith("X")) {
                code = Integer.parseInt(reference.substring(1), 16);
            } else {
                code = Integer.parseInt(reference);
            }
            return Character.isValidCodePoint(code) ? code : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Resolves the references inside an attribute value. Unknown or control references are
     * left as written.
     *
     * @param value The raw attribute value.
     * @return The resolved value.
     */
    public static String unescape(String value) {
        if (value.indexOf('&') < 0) return value;
        return UNESCAPE.translate(value);
    }

    /**
     * Copies numeric references that are invalid or denote control codes through unchanged,
     * so that the numeric unescaper after it never sees them.
     */
    private static final class UnresolvableReferenceKeeper extends CharSequenceTranslator {

        @Override
        public int translate(CharSequence input, int index, Writer out) throws IOException {
            if (input.charAt(index) != '&' || index + 2 >= input.length() || input.charAt(index + 1) != '#') {
                return 0;
            }
            int semi = index + 2;
            while (semi < input.length() && input.charAt(semi) != ';') {
                semi++;
            }
            if (semi >= input.length() || semi == index + 2) {
                return 0;
            }
            Integer code = characterReference(input.subSequence(index + 2, semi).toString());
            if (code != null && !isControlCode(code)) {
                return 0;
            }
            int length = semi + 1 - index;
            out.append(input, index, index + length);
            return length;
        }
    }
}

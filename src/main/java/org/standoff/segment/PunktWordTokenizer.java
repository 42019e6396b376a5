package org.standoff.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rule-based word tokenizer for Swedish text, after the word tokenization of the Punkt
 * sentence splitter. Punctuation is split off words, and a sentence-final period is split
 * off the last word unless that word is a known abbreviation: {@code "piper."} becomes
 * {@code "piper" "."}, while {@code "t.ex."} stays whole.
 * <p>
 * No trained model is involved.
 */
public class PunktWordTokenizer implements SpanTokenizer {

    // Characters that cannot start a word
    private static final String WORD_START = "[^(\"'‘’–—“”»`\\\\{/\\[:;&#*@)}\\]\\-,…]";
    // Characters that cannot appear within a word
    private static final String NON_WORD = "(?:[?!)\"“”»–—\\\\;/}\\]*:'‘’({\\[…%])";
    private static final String MULTI_CHAR = "(?:-{2,}|\\.{2,}|(?:\\.\\s){2,}\\.)";

    private static final Pattern WORD = Pattern.compile(
            MULTI_CHAR
            + "|(?=" + WORD_START + ")\\S+?"
            + "(?=\\s|$|" + NON_WORD + "|" + MULTI_CHAR + "|,(?=$|\\s|" + NON_WORD + "|" + MULTI_CHAR + "))"
            + "|\\S",
            Pattern.UNICODE_CHARACTER_CLASS);

    // Closing quotes and brackets belong to the sentence although they follow its period.
    private static final Pattern POST_SENTENCE = Pattern.compile(
            "[“”\"')\\]}]+?(?:\\s+|(?=--)|$)", Pattern.MULTILINE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATED = Pattern.compile("\\w.*\\.$", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> ABBREVIATIONS = Set.of(
            "a.a", "a.d", "agr", "a.k.a", "alt", "ang", "anm", "art", "avd", "avl", "b.b", "betr", "b.g",
            "b.h", "bif", "bl.a", "b.r.b", "b.t.w", "civ.ek", "civ.ing", "co", "dir", "div", "d.m", "doc",
            "dr", "d.s", "d.s.o", "d.v", "d.v.s", "d.y", "dåv", "d.ä", "e.a.g", "e.d", "eftr", "eg", "ekon",
            "e.kr", "dyl", "em", "e.m", "enl", "e.o", "etc", "e.u", "ev", "ex", "exkl", "f", "farm", "f.d",
            "ff", "fig", "f.kr", "f.m", "f.n", "forts", "fr", "fr.a", "fr.o.m", "f.v.b", "f.v.t", "f.ö",
            "följ", "föreg", "förf", "gr", "g.s", "h.h.k.k.h.h", "h.k.h", "h.m", "ill", "inkl", "i.o.m",
            "st.f", "jur", "kand", "kap", "kl", "lb", "leg", "lic", "lisp", "m.a.a", "mag", "m.a.o", "m.a.p",
            "m.fl", "m.h.a", "m.h.t", "milj", "m.m", "m.m.d", "mom", "m.v.h", "möjl", "n.b", "näml", "nästk",
            "o", "o.d", "odont", "o.dyl", "omkr", "o.m.s", "op", "ordf", "o.s.a", "o.s.v", "pers", "p.gr",
            "p.g.a", "pol", "prel", "prof", "rc", "ref", "resp", "r.i.p", "rst", "s.a.s", "sek", "sekr",
            "sid", "sign", "sistl", "s.k", "sk", "skålp", "s.m", "s.m.s", "sp", "spec", "s.st", "st", "stud",
            "särsk", "tab", "tekn", "tel", "teol", "t.ex", "tf", "t.h", "tim", "t.o.m", "tr", "trol", "t.v",
            "u.p.a", "urspr", "utg", "v", "w", "v.d", "å.k", "ä.k.s", "äv", "ö.g", "ö.h", "ök", "övers");

    @Override
    public List<TextSpan> spanTokenize(String text) {
        List<TextSpan> spans = new ArrayList<>();
        int begin = 0;
        for (String word : tokenize(text)) {
            begin = text.indexOf(word, begin);
            spans.add(new TextSpan(begin, begin + word.length()));
            begin += word.length();
        }
        return spans;
    }

    /**
     * Splits a sentence into words.
     *
     * @param sentence The text to split.
     * @return The words in order, each occurring in {@code sentence}.
     */
    public List<String> tokenize(String sentence) {
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(sentence);
        while (matcher.find()) {
            words.add(matcher.group());
        }

        int pos = words.size() - 1;
        while (pos >= 0 && POST_SENTENCE.matcher(words.get(pos)).lookingAt()) {
            pos--;
        }
        if (pos < 0) {
            return words;
        }
        String endWord = words.get(pos);
        if (PUNCTUATED.matcher(endWord).find()) {
            String stripped = endWord.substring(0, endWord.length() - 1);
            if (!ABBREVIATIONS.contains(stripped)) {
                words.set(pos, stripped);
                words.add(pos + 1, ".");
            }
        }
        return words;
    }
}

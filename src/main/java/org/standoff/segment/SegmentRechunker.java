package org.standoff.segment;

import org.standoff.anchor.AnchorStore;
import org.standoff.anchor.IdentifierGenerator;
import org.standoff.annotation.AnnotationStore;
import org.standoff.corpus.CorpusText;
import org.standoff.corpus.CorpusTextCodec;
import org.standoff.edge.EdgeCodec;
import org.standoff.edge.Span;
import org.standoff.parser.CorpusImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Segments the chunks of an anchored text (e.g. sentences) into smaller units (e.g. words)
 * with a pluggable {@link SpanTokenizer}.
 * <p>
 * The chunk boundaries partition the whole text into intervals. When a segmentation already
 * exists, its segments are kept and carved out of the intervals, so that no existing segment
 * is split or crossed. Anchors that already exist are reused; new anchors come from a generator
 * seeded per document and element, so running twice on the same input gives the same edges.
 */
public class SegmentRechunker {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentRechunker.class);

    private final SpanTokenizer tokenizer;

    public SegmentRechunker(SpanTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * The outcome of a segmentation.
     *
     * @param corpusText The corpus text, including any anchors created for new segments.
     * @param segments The existing segments followed by the new ones, edge to (empty) value.
     * @param newAnchors The number of anchors created.
     */
    public record Result(CorpusText corpusText, Map<String, String> segments, int newAnchors) {
    }

    /**
     * Segments the chunks of a corpus text.
     *
     * @param corpus The anchored corpus text.
     * @param chunks The chunk edges, e.g. the keys of a sentence annotation.
     * @param existingSegments A previous segmentation, or {@code null}.
     * @param element The name of the new segment edges, e.g. {@code w}.
     * @param prefix The prefix and seed of new anchors, normally the document prefix.
     * @return The segmentation.
     * @throws UnknownAnchorException if a chunk or an existing segment refers to an unknown anchor.
     */
    public Result rechunk(CorpusText corpus, Collection<String> chunks, Map<String, String> existingSegments,
                          String element, String prefix) {
        AnchorStore anchors = new AnchorStore(
                new IdentifierGenerator(prefix + EdgeCodec.EDGE_SEPARATOR + element, Math.max(1, corpus.length())),
                prefix, corpus.positionToAnchor());
        String text = corpus.text();

        // "one two <s>three four</s> five" ==> ["one two ", "three four", " five"]
        TreeSet<Integer> positions = new TreeSet<>();
        positions.add(0);
        positions.add(text.length());
        for (String chunk : chunks) {
            for (Span span : EdgeCodec.spans(chunk)) {
                positions.add(resolve(anchors, span.start(), chunk));
                positions.add(resolve(anchors, span.end(), chunk));
            }
        }
        List<TextSpan> intervals = new ArrayList<>();
        Integer previous = null;
        for (Integer position : positions) {
            if (previous != null) {
                intervals.add(new TextSpan(previous, position));
            }
            previous = position;
        }

        Map<String, String> segments = new LinkedHashMap<>();
        if (existingSegments != null) {
            List<TextSpan> existing = new ArrayList<>();
            for (String edge : existingSegments.keySet()) {
                for (Span span : EdgeCodec.spans(edge)) {
                    existing.add(new TextSpan(resolve(anchors, span.start(), edge), resolve(anchors, span.end(), edge)));
                }
                segments.put(edge, existingSegments.get(edge));
            }
            Collections.sort(existing);
            carve(intervals, existing);
            LOG.info("Reorganized into {} chunks", intervals.size());
        }

        int anchorsBefore = anchors.size();
        for (TextSpan interval : intervals) {
            if (interval.isEmpty()) continue;
            for (TextSpan span : tokenizer.spanTokenize(text.substring(interval.start(), interval.end()))) {
                TextSpan absolute = span.shift(interval.start());
                if (absolute.isEmpty() || isBlank(text.substring(absolute.start(), absolute.end()))) {
                    continue;
                }
                String edge = EdgeCodec.encode(element, anchors.anchorAt(absolute.start()), anchors.anchorAt(absolute.end()));
                segments.put(edge, "");
            }
        }

        int created = anchors.size() - anchorsBefore;
        CorpusText updated = created == 0 ? corpus : CorpusText.of(text, anchors.positionToAnchor());
        return new Result(updated, segments, created);
    }

    /**
     * Segments chunks read from files and writes the segmentation. The corpus text file is
     * rewritten only when new anchors were needed.
     *
     * @param textFile The corpus text file.
     * @param chunkFile The annotation whose keys are the chunk edges.
     * @param existingFile A previous segmentation, or {@code null}.
     * @param outFile The annotation file to write.
     * @param element The name of the new segment edges.
     * @return The segmentation.
     * @throws IOException if a file cannot be read or written.
     */
    public Result rechunk(Path textFile, Path chunkFile, Path existingFile, Path outFile, String element) throws IOException {
        CorpusText corpus = CorpusTextCodec.read(textFile);
        Map<String, String> chunks = AnnotationStore.read(chunkFile);
        Map<String, String> existing = existingFile != null ? AnnotationStore.read(existingFile) : null;

        Result result = rechunk(corpus, chunks.keySet(), existing, element, CorpusImporter.defaultPrefix(textFile));

        if (result.newAnchors() > 0) {
            CorpusTextCodec.write(textFile, result.corpusText());
        }
        AnnotationStore.write(outFile, result.segments());
        return result;
    }

    // Existing segments are cut out of the intervals; the pieces around them become intervals of their own.
    private static void carve(List<TextSpan> intervals, List<TextSpan> existing) {
        int count = intervals.size();
        for (int n = 0; n < count; n++) {
            int chunkStart = intervals.get(n).start();
            int chunkEnd = intervals.get(n).end();
            for (TextSpan token : existing) {
                if (token.end() <= chunkStart) continue;
                if (token.start() >= chunkEnd) break;
                if (chunkStart != token.start()) {
                    intervals.add(new TextSpan(chunkStart, token.start()));
                }
                chunkStart = token.end();
                intervals.set(n, new TextSpan(chunkStart, chunkEnd));
            }
        }
        Collections.sort(intervals);
    }

    // Unicode spaces such as U+00A0 count as blank, unlike String.isBlank().
    static boolean isBlank(String span) {
        return span.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }

    private static int resolve(AnchorStore anchors, String anchor, String edge) {
        Integer position = anchors.positionOf(anchor);
        if (position == null) {
            throw new UnknownAnchorException(anchor, edge);
        }
        return position;
    }
}

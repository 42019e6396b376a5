package org.standoff.analyzer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.standoff.diagnostics.DiagnosticsEngine;
import org.standoff.junit.extensions.logging.ExpectLog;
import org.standoff.junit.extensions.logging.LogLevel;
import org.standoff.junit.extensions.logging.LogWatchExtension;
import org.standoff.markup.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class XmlAnalyzerTest {

    private final XmlAnalyzer analyzer = new XmlAnalyzer("teiHeader", new DiagnosticsEngine());

    @Test
    void countsElementsAttributesCharactersAndEntities() {
        // Act
        analyzer.analyze("one.xml", "<teiHeader><title>T</title></teiHeader><p n=\"1\">a&amp;b</p><p>a</p>");

        // Assert
        ItemStatistics p = analyzer.statistics(XmlAnalyzer.Category.TAG).get("p");
        assertThat(p.frequency()).isEqualTo(2);
        assertThat(p.attributes()).containsExactly("n");
        assertThat(p.firstOccurrence()).containsOnlyKeys("one.xml");
        assertThat(p.firstOccurrence().get("one.xml")).isEqualTo(new SourceLocation(1, 39, 39));
        assertThat(analyzer.statistics(XmlAnalyzer.Category.HEADER)).containsOnlyKeys("teiheader", "title");
        assertThat(analyzer.statistics(XmlAnalyzer.Category.CHAR).get("a").frequency()).isEqualTo(2);
        assertThat(analyzer.statistics(XmlAnalyzer.Category.ENTITY).get("amp").frequency()).isEqualTo(1);
        assertThat(analyzer.errorCounts()).containsEntry("one.xml", 0);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = ".*Closing element </b>, but it is not open")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = ".*Autoclosing tag </p>.*")
    void countsProblemsPerFile() {
        // Act
        analyzer.analyze("bad.xml", "<p>x</b>");
        analyzer.analyze("good.xml", "<p>x</p>");

        // Assert
        assertThat(analyzer.errorCounts()).containsEntry("bad.xml", 2).containsEntry("good.xml", 0);
        assertThat(analyzer.statistics(XmlAnalyzer.Category.TAG).get("p").firstOccurrence())
                .containsOnlyKeys("bad.xml", "good.xml");
    }

    @Test
    void reportListsOnlyRareItems() {
        // Arrange
        analyzer.analyze("one.xml", "<p>x</p><p>y</p><q>z</q>");

        // Act
        String all = analyzer.report(0);
        String rare = analyzer.report(2);

        // Assert
        assertThat(all).contains("<p>", "<q>", "U+0078 'x'");
        assertThat(rare).contains("<q>").doesNotContain("<p>");
        assertThat(rare).contains("0 errors, 0 warnings  one.xml");
    }
}

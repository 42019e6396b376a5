package org.standoff.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.standoff.parser.ElementKey;
import org.standoff.parser.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ParserConfigLoader}, layered over the shipped defaults.
 */
@Tag("unit")
class ParserConfigLoaderTest {

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
    }

    @Test
    void defaultsGiveAnEmptyConfiguration() {
        // Act
        ParserConfig config = ParserConfigLoader.fromConfig(withDefaults(""));

        // Assert
        assertThat(config.headerElement()).isEqualTo(ParserConfig.DEFAULT_HEADER_ELEMENT);
        assertThat(config.annotations()).isEmpty();
        assertThat(config.skipped()).isEmpty();
        assertThat(ParserConfigLoader.prefix(withDefaults(""))).isNull();
    }

    @Test
    void readsTheParserBlock() {
        // Arrange
        Config hocon = withDefaults("""
            standoff.parser {
              header-element = "header"
              elements = [
                { elements = "s+p", annotation = "chunks" }
                { elements = "w:lemma", annotation = "lemma" }
              ]
              skip = [ "lb", "w:pos" ]
              overlap = [ "s+p" ]
              prefix = "corpus1"
            }
            """);

        // Act
        ParserConfig config = ParserConfigLoader.fromConfig(hocon);

        // Assert
        assertThat(config.headerElement()).isEqualTo("header");
        assertThat(config.annotationFor(ElementKey.element("p"))).isEqualTo("chunks");
        assertThat(config.annotationFor(new ElementKey("w", "lemma"))).isEqualTo("lemma");
        assertThat(config.isSkipped(new ElementKey("w", "pos"))).isTrue();
        assertThat(config.canOverlap("p", "s")).isTrue();
        assertThat(ParserConfigLoader.prefix(hocon)).isEqualTo("corpus1");
    }

    @Test
    void inconsistentSettingsAreRejected() {
        Config hocon = withDefaults("standoff.parser { elements = [ { elements = w, annotation = tokens } ], skip = [ w ] }");

        assertThatThrownBy(() -> ParserConfigLoader.fromConfig(hocon)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wrongTypesAreRejected() {
        Config hocon = withDefaults("standoff.parser.skip = 3");

        assertThatThrownBy(() -> ParserConfigLoader.fromConfig(hocon)).isInstanceOf(ConfigException.WrongType.class);
    }
}

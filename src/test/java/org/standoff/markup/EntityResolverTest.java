package org.standoff.markup;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class EntityResolverTest {

    @Test
    void resolvesHtmlXmlAndLatin2Entities() {
        assertThat(EntityResolver.entity("amp")).isEqualTo((int) '&');
        assertThat(EntityResolver.entity("eacute")).isEqualTo(0xE9);
        assertThat(EntityResolver.entity("hellip")).isEqualTo(0x2026);
        assertThat(EntityResolver.entity("apos")).isEqualTo((int) '\'');
        assertThat(EntityResolver.entity("scaron")).isEqualTo(0x161);
        assertThat(EntityResolver.entity("cir")).isEqualTo(0x25CB);
        assertThat(EntityResolver.entity("bogus")).isNull();
    }

    @Test
    void parsesCharacterReferences() {
        assertThat(EntityResolver.characterReference("65")).isEqualTo(65);
        assertThat(EntityResolver.characterReference("x41")).isEqualTo(65);
        assertThat(EntityResolver.characterReference("X263a")).isEqualTo(0x263A);
        assertThat(EntityResolver.characterReference("1114112")).isNull();
        assertThat(EntityResolver.characterReference("99999999999")).isNull();
    }

    @Test
    void detectsControlCodes() {
        assertThat(EntityResolver.isControlCode(0x1F)).isTrue();
        assertThat(EntityResolver.isControlCode(0x20)).isFalse();
        assertThat(EntityResolver.isControlCode(0x85)).isTrue();
        assertThat(EntityResolver.isControlCode(0xA0)).isFalse();
    }

    @Test
    void unescapeKeepsUnknownReferences() {
        assertThat(EntityResolver.unescape("a&lt;b&#x263A;&bogus;&#1;")).isEqualTo("a<b☺&bogus;&#1;");
        assertThat(EntityResolver.unescape("no refs")).isEqualTo("no refs");
    }

    @Test
    void unescapeResolvesLatin2AndKeepsOutOfRangeReferences() {
        assertThat(EntityResolver.unescape("&Scaron;&#65;&#X42; &#99999999;&#x85;&#;&"))
                .isEqualTo("\u0160AB &#99999999;&#x85;&#;&");
    }
}

package org.standoff.config;

import com.typesafe.config.Config;
import org.standoff.parser.ParserConfig;

/**
 * Builds a validated {@link ParserConfig} from the {@code standoff.parser} block.
 *
 * <pre>
 * standoff.parser {
 *   header-element = "teiheader"
 *   elements = [ { elements = "w", annotation = "tokens" }, { elements = "w:lemma", annotation = "lemma" } ]
 *   skip = [ "lb" ]
 *   overlap = [ "s+p" ]
 * }
 * </pre>
 */
public final class ParserConfigLoader {

    public static final String PARSER_PATH = "standoff.parser";
    public static final String PREFIX_PATH = PARSER_PATH + ".prefix";

    private ParserConfigLoader() {
    }

    /**
     * Reads the parser block of a resolved configuration.
     *
     * @param config The application configuration.
     * @return The parser configuration.
     * @throws com.typesafe.config.ConfigException if a key has the wrong type or is missing.
     * @throws IllegalArgumentException if the parser settings are inconsistent.
     */
    public static ParserConfig fromConfig(Config config) {
        Config parser = config.getConfig(PARSER_PATH);
        ParserConfig.Builder builder = ParserConfig.builder()
                .headerElement(parser.getString("header-element"))
                .skip(parser.getStringList("skip"))
                .overlap(parser.getStringList("overlap"));
        for (Config element : parser.getConfigList("elements")) {
            builder.annotate(element.getString("elements"), element.getString("annotation"));
        }
        return builder.build();
    }

    /**
     * Returns the configured anchor prefix, or {@code null} when it is derived from the file name.
     */
    public static String prefix(Config config) {
        if (!config.hasPath(PREFIX_PATH)) {
            return null;
        }
        String prefix = config.getString(PREFIX_PATH);
        return prefix.isEmpty() ? null : prefix;
    }
}

package org.reportforge.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueType;

import java.math.BigDecimal;

/**
 * Document-level settings used to build the markup preamble. Every option is
 * independently optional; an absent option produces no directive at all.
 *
 * @param pageSize The paper name, e.g. {@code a4}. Can be null.
 * @param margin The page margin as a length, e.g. {@code 2cm}. Can be null.
 * @param font The default font family. Can be null.
 * @param fontSize The default font size as a length, e.g. {@code 10pt}. Can be null.
 */
public record DocumentOptions(String pageSize, String margin, String font, String fontSize) {

    private static final String RENDERER_PATH = "renderer";

    /**
     * @return Options without any directive.
     */
    public static DocumentOptions none() {
        return new DocumentOptions(null, null, null, null);
    }

    /**
     * Reads the options from the {@code renderer} section of the application config.
     * Numeric margins and font sizes are interpreted as points.
     *
     * @param config The application config.
     * @return The document options, never null.
     */
    public static DocumentOptions fromConfig(Config config) {
        if (!config.hasPath(RENDERER_PATH)) {
            return none();
        }
        Config renderer = config.getConfig(RENDERER_PATH);
        return new DocumentOptions(
                renderer.hasPath("page-size") ? renderer.getString("page-size") : null,
                length(renderer, "margin"),
                renderer.hasPath("font") ? renderer.getString("font") : null,
                length(renderer, "font-size"));
    }

    public DocumentOptions withPageSize(String value) {
        return new DocumentOptions(value, margin, font, fontSize);
    }

    public DocumentOptions withMargin(String value) {
        return new DocumentOptions(pageSize, value, font, fontSize);
    }

    public DocumentOptions withFont(String value) {
        return new DocumentOptions(pageSize, margin, value, fontSize);
    }

    public DocumentOptions withFontSize(String value) {
        return new DocumentOptions(pageSize, margin, font, value);
    }

    private static String length(Config renderer, String key) {
        if (!renderer.hasPath(key)) {
            return null;
        }
        if (renderer.getValue(key).valueType() == ConfigValueType.NUMBER) {
            BigDecimal points = new BigDecimal(renderer.getNumber(key).toString()).stripTrailingZeros();
            return points.toPlainString() + "pt";
        }
        return renderer.getString(key);
    }
}

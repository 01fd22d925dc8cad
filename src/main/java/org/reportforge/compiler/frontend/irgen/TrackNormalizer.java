package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.InvalidTrackDefinitionException;
import org.reportforge.compiler.api.SourceInfo;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Converts column and row declarations into a canonical list of track sizes.
 * <ul>
 *   <li>absent: no tracks</li>
 *   <li>{@code auto}: a single {@code "auto"} track</li>
 *   <li>a count {@code n} from 1 to {@value #MAX_TRACKS}: {@code n} auto tracks</li>
 *   <li>a list: each entry converted on its own. {@code auto} and size strings pass through,
 *       {@code {fr = n}} becomes {@code "nfr"} and a bare number is a size in points.
 *       Fractions and sizes must be positive.</li>
 * </ul>
 */
public final class TrackNormalizer {

    /** Largest track count accepted in the count form. */
    public static final int MAX_TRACKS = 1000;

    private static final String AUTO = "auto";

    private TrackNormalizer() {}

    /**
     * @param declaration The raw declaration. Can be null.
     * @param axis Whether the declaration sizes columns or rows.
     * @param source Where the declaration was made.
     * @return The track sizes in order, never null.
     * @throws InvalidTrackDefinitionException if the declaration has no track meaning.
     */
    public static List<String> normalize(Object declaration, TrackAxis axis, SourceInfo source)
            throws InvalidTrackDefinitionException {
        if (declaration == null) {
            return List.of();
        }
        if (AUTO.equals(declaration)) {
            return List.of(AUTO);
        }
        if (declaration instanceof Integer || declaration instanceof Long) {
            long count = ((Number) declaration).longValue();
            if (count <= 0 || count > MAX_TRACKS) {
                throw new InvalidTrackDefinitionException(axis, declaration, source);
            }
            return Collections.nCopies((int) count, AUTO);
        }
        if (declaration instanceof List<?> entries) {
            List<String> tracks = new ArrayList<>(entries.size());
            for (Object entry : entries) {
                String track = track(entry);
                if (track == null) {
                    throw new InvalidTrackDefinitionException(axis, declaration, source);
                }
                tracks.add(track);
            }
            return List.copyOf(tracks);
        }
        throw new InvalidTrackDefinitionException(axis, declaration, source);
    }

    private static String track(Object entry) {
        if (entry instanceof String s) {
            return s;
        }
        if (entry instanceof Number n) {
            return positive(n) ? plain(n) + "pt" : null;
        }
        if (entry instanceof Map<?, ?> map && map.size() == 1 && map.get("fr") instanceof Number fr) {
            return positive(fr) ? plain(fr) + "fr" : null;
        }
        return null;
    }

    private static boolean positive(Number n) {
        if (n instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return false;
        }
        return new BigDecimal(n.toString()).signum() > 0;
    }

    private static String plain(Number n) {
        return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
    }
}

package eu.virtualparadox.ragqa.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counting and truncation with the cl100k_base encoding.
 * <p>
 * Used to keep judge excerpts and generation context within a token budget. Exact
 * counts only matter relative to each other here, so one encoding serves every model.
 */
public final class TokenUtil {

    private static final String ELLIPSIS = "...";

    private static final Encoding ENCODING = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param text input, may be null
     * @return token count, 0 for null or empty text
     */
    public static int countTokens(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return ENCODING.countTokens(text);
    }

    /**
     * Cuts text down to at most {@code maxTokens} tokens; a cut text gets a trailing "...".
     *
     * @param text      input, may be null
     * @param maxTokens token budget
     * @return the text itself when it fits, "" for null input or a non-positive budget
     */
    public static String truncate(final String text, final int maxTokens) {
        if (text == null || text.isEmpty() || maxTokens <= 0) {
            return "";
        }
        final EncodingResult encoded = ENCODING.encode(text, maxTokens);
        if (!encoded.isTruncated()) {
            return text;
        }
        return ENCODING.decode(encoded.getTokens()).stripTrailing() + ELLIPSIS;
    }
}

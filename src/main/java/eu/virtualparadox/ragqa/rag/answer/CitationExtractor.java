package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the context chunks an answer refers to.
 * <p>
 * A chunk is cited when the answer carries its 1-based context number in brackets
 * ({@code [2]}, {@code [1, 3]}) or contains its chunk id as a whole token. Citations follow context
 * order. When nothing in the answer points at a context chunk, the answer has no usable
 * attribution and every context chunk is cited, flagged as inferred.
 */
@Component
public class CitationExtractor {

    private static final Pattern MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)]");

    /**
     * @param cited    cited chunks, in context order
     * @param inferred true when {@code cited} is the whole context for lack of references
     */
    public record Citations(List<Chunk> cited, boolean inferred) {
    }

    public Citations extract(final String answer, final List<Chunk> context) {
        final boolean[] referenced = new boolean[context.size()];

        final Matcher matcher = MARKER.matcher(answer);
        while (matcher.find()) {
            for (final String number : matcher.group(1).split(",")) {
                final int index = parseIndex(number.trim());
                if (index >= 1 && index <= context.size()) {
                    referenced[index - 1] = true;
                }
            }
        }
        for (int i = 0; i < context.size(); i++) {
            final String chunkId = context.get(i).chunkId();
            if (!referenced[i] && chunkId != null && !chunkId.isBlank() && mentions(answer, chunkId)) {
                referenced[i] = true;
            }
        }

        final List<Chunk> cited = new ArrayList<>();
        for (int i = 0; i < context.size(); i++) {
            if (referenced[i]) {
                cited.add(context.get(i));
            }
        }
        if (cited.isEmpty()) {
            return new Citations(List.copyOf(context), true);
        }
        return new Citations(List.copyOf(cited), false);
    }

    /**
     * True when {@code chunkId} occurs as a whole token, so {@code k23-10} does not cite {@code k23-1}.
     */
    private boolean mentions(final String answer, final String chunkId) {
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(chunkId) + "(?![\\w-])").matcher(answer).find();
    }

    private int parseIndex(final String number) {
        // guards against overflow on absurdly long digit runs
        if (number.length() > 6) {
            return -1;
        }
        return Integer.parseInt(number);
    }
}

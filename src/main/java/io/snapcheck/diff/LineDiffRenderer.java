package io.snapcheck.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-oriented diff with a three-column gutter: unchanged, inserted and deleted lines.
 */
public final class LineDiffRenderer implements DiffRenderer {
    static final String EQUAL = "   ";
    static final String INSERT = "  +";
    static final String DELETE = "  -";
    private static final String SEPARATOR = "   ";

    @Override
    public String render(String before, String after) {
        List<String> original = split(before);
        List<String> revised = split(after);
        Patch<String> patch = DiffUtils.diff(original, revised);

        List<String> out = new ArrayList<>(original.size() + revised.size());
        int position = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            Chunk<String> source = delta.getSource();
            Chunk<String> target = delta.getTarget();
            while (position < source.getPosition()) {
                out.add(EQUAL + SEPARATOR + original.get(position++));
            }
            switch (delta.getType()) {
                case DELETE -> add(out, DELETE, source.getLines());
                case INSERT -> add(out, INSERT, target.getLines());
                case CHANGE -> {
                    add(out, DELETE, source.getLines());
                    add(out, INSERT, target.getLines());
                }
                case EQUAL -> add(out, EQUAL, source.getLines());
                default -> throw new IllegalStateException("Unhandled delta type: " + delta.getType());
            }
            position = source.getPosition() + source.size();
        }
        while (position < original.size()) {
            out.add(EQUAL + SEPARATOR + original.get(position++));
        }
        return String.join("\n", out);
    }

    private static void add(List<String> out, String gutter, List<String> lines) {
        for (String line : lines) {
            out.add(gutter + SEPARATOR + line);
        }
    }

    private static List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.replace("\r\n", "\n").split("\n", -1));
    }
}

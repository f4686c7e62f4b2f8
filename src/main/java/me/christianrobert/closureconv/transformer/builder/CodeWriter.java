package me.christianrobert.closureconv.transformer.builder;

import me.christianrobert.closureconv.transformer.context.Declaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Indentation-aware text buffer.
 *
 * <p>The buffer is a list of chunks. A declaration keyword is kept as its {@link Declaration}
 * and rendered only when text is read, so it reflects mutations emitted after the line.
 * Positions are chunk indexes.</p>
 */
public class CodeWriter {

    private static final String INDENT_UNIT = "    ";

    private final List<Object> chunks = new ArrayList<>();
    private int level = 0;

    public void write(String text) {
        chunks.add(text);
    }

    public void writeIndent() {
        for (int i = 0; i < level; i++) {
            chunks.add(INDENT_UNIT);
        }
    }

    public void writeLine(String text) {
        writeIndent();
        chunks.add(text + "\n");
    }

    /**
     * Writes {@code <keyword> <text>} as one line, the keyword taken from the declaration at
     * render time.
     */
    public void writeDeclaration(Declaration declaration, String text) {
        writeIndent();
        chunks.add(declaration);
        chunks.add(" " + text + "\n");
    }

    public void indent() {
        level++;
    }

    public void dedent() {
        if (level == 0) {
            throw new IllegalStateException("Cannot dedent below level 0");
        }
        level--;
    }

    public int getLevel() {
        return level;
    }

    public int position() {
        return chunks.size();
    }

    public String since(int mark) {
        if (mark < 0 || mark > chunks.size()) {
            throw new IllegalArgumentException("Mark " + mark + " is outside the buffer (" + chunks.size() + " chunks)");
        }
        return render(mark);
    }

    private String render(int from) {
        StringBuilder out = new StringBuilder();
        for (int i = from; i < chunks.size(); i++) {
            Object chunk = chunks.get(i);
            if (chunk instanceof Declaration) {
                out.append(((Declaration) chunk).keyword());
            } else {
                out.append((String) chunk);
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return render(0);
    }
}

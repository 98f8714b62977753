package com.quarry.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted form of a formula: a fenced markdown block tagged {@code formula} holding only the
 * expression text.
 */
public final class FormulaBlocks {

    public static final String FENCE = "```";
    public static final String LANGUAGE = "formula";

    private FormulaBlocks() {}

    public static String toMarkdown(String formula) {
        String body = (formula == null) ? "" : formula.trim();
        return FENCE + LANGUAGE + "\n" + body + "\n" + FENCE;
    }

    /**
     * Expression text of every formula block in the document, in order. Blocks are trimmed;
     * an unterminated block at the end of the document is ignored.
     */
    public static List<String> extract(String markdown) {
        if (markdown == null || markdown.isEmpty()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        String[] lines = markdown.split("\r?\n", -1);
        StringBuilder body = null;
        for (String line : lines) {
            String trimmed = line.trim();
            if (body == null) {
                if (trimmed.startsWith(FENCE) && trimmed.substring(FENCE.length()).trim().equalsIgnoreCase(LANGUAGE)) {
                    body = new StringBuilder();
                }
            } else if (trimmed.equals(FENCE)) {
                out.add(body.toString().trim());
                body = null;
            } else {
                if (body.length() > 0) body.append('\n');
                body.append(line);
            }
        }
        return out;
    }
}

package com.tyron.nsedit.lang.newspeak.text;

import com.tyron.nsedit.api.editor.Document;
import com.tyron.nsedit.core.editor.document.Indentation;
import com.tyron.nsedit.core.editor.document.LineIndex;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link SourceBuffer} over a string captured at creation time.
 * <p>
 * Strings are {@code '...'} with {@code ''} as an escaped quote; comments are {@code (* ... *)} or
 * {@code "..."} and do not nest. Regions are found once, when the snapshot is built.
 */
public final class SourceSnapshot implements SourceBuffer {

    private final String text;
    private final LineIndex lines;
    private final List<SyntaxRegion> regions;
    private final int[] regionStarts;

    public SourceSnapshot(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.lines = LineIndex.of(text);
        this.regions = findRegions(text);
        this.regionStarts = new int[regions.size()];
        for (int i = 0; i < regionStarts.length; i++) {
            regionStarts[i] = regions.get(i).start();
        }
    }

    public static SourceSnapshot of(@NotNull Document document) {
        return new SourceSnapshot(document.getText());
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        return text.charAt(index);
    }

    @Override
    public @NotNull CharSequence subSequence(int start, int end) {
        return text.subSequence(start, end);
    }

    @Override
    public @NotNull String toString() {
        return text;
    }

    @Override
    public String slice(int start, int end) {
        return text.substring(start, end);
    }

    public List<SyntaxRegion> getRegions() {
        return List.copyOf(regions);
    }

    @Override
    public @Nullable SyntaxRegion syntaxRegionAt(int offset) {
        int idx = lastRegionStartingAtOrBefore(offset);
        if (idx < 0) return null;
        SyntaxRegion region = regions.get(idx);
        return region.covers(offset) ? region : null;
    }

    @Override
    public @Nullable SyntaxRegion syntaxContextAt(int offset) {
        int idx = lastRegionStartingAtOrBefore(offset);
        if (idx < 0) return null;
        SyntaxRegion region = regions.get(idx);
        return region.encloses(offset) ? region : null;
    }

    @Override
    public int getLineCount() {
        return lines.getLineCount();
    }

    @Override
    public int getLineStartOffset(int line) {
        return lines.getLineStartOffset(line);
    }

    @Override
    public int getLineEndOffset(int line) {
        return lines.getLineEndOffset(line);
    }

    @Override
    public int getLineNumber(int offset) {
        return lines.getLineNumber(offset);
    }

    @Override
    public int getFirstNonBlankOffset(int line) {
        return Indentation.skipBlanks(text, getLineStartOffset(line), getLineEndOffset(line));
    }

    @Override
    public int getIndentation(int line) {
        return Indentation.width(text, getLineStartOffset(line), getFirstNonBlankOffset(line));
    }

    private int lastRegionStartingAtOrBefore(int offset) {
        int lo = 0;
        int hi = regionStarts.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (regionStarts[mid] <= offset) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    private static List<SyntaxRegion> findRegions(String text) {
        List<SyntaxRegion> result = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'') {
                int j = i + 1;
                int end = -1;
                while (j < n) {
                    if (text.charAt(j) == '\'') {
                        if (j + 1 < n && text.charAt(j + 1) == '\'') {
                            j += 2;
                            continue;
                        }
                        end = j + 1;
                        break;
                    }
                    j++;
                }
                i = addRegion(result, SyntaxRegion.Kind.STRING, i, end, n);
            } else if (c == '(' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*)", i + 2);
                i = addRegion(result, SyntaxRegion.Kind.COMMENT, i, close < 0 ? -1 : close + 2, n);
            } else if (c == '"') {
                int close = text.indexOf('"', i + 1);
                i = addRegion(result, SyntaxRegion.Kind.COMMENT, i, close < 0 ? -1 : close + 1, n);
            } else {
                i++;
            }
        }
        return result;
    }

    private static int addRegion(List<SyntaxRegion> out, SyntaxRegion.Kind kind, int start, int end, int length) {
        boolean terminated = end >= 0;
        int regionEnd = terminated ? end : length;
        out.add(new SyntaxRegion(kind, start, regionEnd, terminated));
        return regionEnd;
    }
}

package com.ciro.remi.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Convierte offsets en números de línea contando los saltos de línea previos.
 * Los offsets de salto se precalculan una vez; cada consulta es O(log N).
 */
public final class SourceLines {

    private final int[] newlines;

    public SourceLines(String source) {
        List<Integer> found = new ArrayList<>();
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') found.add(i);
        }
        this.newlines = found.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(newlines, offset);
        // binarySearch devuelve (-(punto de inserción) - 1) si no lo encuentra
        int before = idx >= 0 ? idx : -idx - 1;
        return before + 1;
    }

    public SourceSpan spanOf(int offset) {
        return new SourceSpan(offset, lineOf(offset));
    }
}

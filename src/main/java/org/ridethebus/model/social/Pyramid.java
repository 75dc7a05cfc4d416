package org.ridethebus.model.social;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pyramide 5-4-3-2-1. {@code rows.get(0)} est la rangée du bas (5 cartes).
 * Le curseur pointe la dernière carte retournée (-1 tant qu'aucune ne l'est).
 */
@Data
@NoArgsConstructor
public class Pyramid {
    public static final int[] ROW_SIZES = {5, 4, 3, 2, 1};

    private List<List<PyramidCell>> rows = new ArrayList<>();
    private int cursorRow = -1;
    private int cursorCol = -1;
    // nombre de cartes posées par joueur sur la carte retournée courante
    private Map<String, Integer> commits = new LinkedHashMap<>();

    public PyramidCell currentCell() {
        if (cursorRow < 0) return null;
        return rows.get(cursorRow).get(cursorCol);
    }

    public int flippedCount() {
        int n = 0;
        for (List<PyramidCell> row : rows) {
            for (PyramidCell c : row) if (c.isFaceUp()) n++;
        }
        return n;
    }

    public int cellCount() {
        return rows.stream().mapToInt(List::size).sum();
    }

    public boolean allFlipped() {
        return !rows.isEmpty() && flippedCount() == cellCount();
    }

    public int commitsOf(String playerId) {
        return commits.getOrDefault(playerId, 0);
    }

    public Pyramid copy() {
        Pyramid p = new Pyramid();
        for (List<PyramidCell> row : rows) {
            List<PyramidCell> r = new ArrayList<>(row.size());
            for (PyramidCell c : row) r.add(new PyramidCell(c.getCard(), c.isFaceUp()));
            p.rows.add(r);
        }
        p.cursorRow = cursorRow;
        p.cursorCol = cursorCol;
        p.commits = new LinkedHashMap<>(commits);
        return p;
    }
}

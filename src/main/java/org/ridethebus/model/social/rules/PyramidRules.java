package org.ridethebus.model.social.rules;

import org.ridethebus.model.card.Deck;
import org.ridethebus.model.social.Pyramid;
import org.ridethebus.model.social.PyramidCell;

import java.util.ArrayList;
import java.util.List;

public final class PyramidRules {
    private PyramidRules(){}

    public static Pyramid layout(Deck deck) {
        Pyramid p = new Pyramid();
        for (int size : Pyramid.ROW_SIZES) {
            List<PyramidCell> row = new ArrayList<>(size);
            for (int i = 0; i < size; i++) row.add(new PyramidCell(deck.draw(), false));
            p.getRows().add(row);
        }
        return p;
    }

    /** Retourne la prochaine carte face cachée (bas → haut, gauche → droite) et remet les poses à zéro. */
    public static PyramidCell flipNext(Pyramid p) {
        for (int r = 0; r < p.getRows().size(); r++) {
            List<PyramidCell> row = p.getRows().get(r);
            for (int c = 0; c < row.size(); c++) {
                PyramidCell cell = row.get(c);
                if (!cell.isFaceUp()) {
                    cell.setFaceUp(true);
                    p.setCursorRow(r);
                    p.setCursorCol(c);
                    p.getCommits().clear();
                    return cell;
                }
            }
        }
        return null;
    }
}

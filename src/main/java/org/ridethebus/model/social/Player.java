package org.ridethebus.model.social;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.ridethebus.model.card.Card;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    private String id;               // p1, p2... dans l'ordre d'arrivée
    private String name;
    private List<Card> hand = new ArrayList<>();
    private int drinksReceived = 0;
    private int drinksAssigned = 0;
    private boolean busRider = false;

    public Player(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public Optional<Card> topCard() {
        return hand.stream().max(Comparator.comparingInt(Card::rankValue));
    }

    public Optional<Card> firstMatching(Card.Rank rank) {
        return hand.stream().filter(c -> c.getRank() == rank).findFirst();
    }

    public Player copy() {
        return new Player(id, name, new ArrayList<>(hand), drinksReceived, drinksAssigned, busRider);
    }
}

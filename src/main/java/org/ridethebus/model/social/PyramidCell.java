package org.ridethebus.model.social;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.ridethebus.model.card.Card;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PyramidCell {
    private Card card;
    private boolean faceUp = false;
}

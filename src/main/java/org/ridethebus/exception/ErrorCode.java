package org.ridethebus.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    INVALID_STATE("Action impossible dans l'état actuel de la partie"),
    INVALID_GUESS("Annonce invalide pour cette manche"),
    EMPTY_HAND("Aucune carte correspondante en main"),

    // fatals : bug d'approvisionnement ou de configuration
    EMPTY_DECK("Paquet épuisé"),
    INVALID_CONFIG("Configuration invalide"),
    INVALID_SNAPSHOT("Sauvegarde de partie illisible");

    private final String msg;
}

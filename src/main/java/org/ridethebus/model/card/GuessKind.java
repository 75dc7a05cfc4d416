package org.ridethebus.model.card;

public enum GuessKind { COLOR, DIRECTION, RANGE, SUIT }

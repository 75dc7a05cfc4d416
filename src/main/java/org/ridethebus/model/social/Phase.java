package org.ridethebus.model.social;

public enum Phase { DEAL, PYRAMID, BUS, FINISHED }

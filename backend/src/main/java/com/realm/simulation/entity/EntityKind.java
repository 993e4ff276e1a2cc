package com.realm.simulation.entity;

public enum EntityKind {

    LOCATION,

    NPC
}

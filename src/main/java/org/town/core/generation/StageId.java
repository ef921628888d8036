package org.town.core.generation;

public enum StageId {
    GROUND,
    ROADS,
    CONNECT_ROADS,
    OBJECTS,
    VALIDATE
}

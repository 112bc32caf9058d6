package org.carball.stackcost.model.recommendation;

public enum Impact {
    HIGH,
    MEDIUM,
    LOW
}

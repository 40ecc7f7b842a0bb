package com.autonomous.crew.team;

public enum ModelTier {
    CREATIVE,
    ANALYTICAL,
    ROUTINE
}

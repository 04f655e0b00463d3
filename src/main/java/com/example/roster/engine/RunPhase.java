package com.example.roster.engine;

public enum RunPhase {
    INITIALIZED,
    EXPANDING,
    ASSIGNING,
    FINALIZED
}

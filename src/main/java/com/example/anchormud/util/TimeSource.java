package com.example.anchormud.util;

/**
 * Source of real elapsed time in milliseconds. Injected into the game clock
 * so tests can advance time by hand.
 */
@FunctionalInterface
public interface TimeSource {

    TimeSource SYSTEM = System::currentTimeMillis;

    long currentMillis();
}

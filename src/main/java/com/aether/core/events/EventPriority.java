package com.aether.core.events;

/**
 * Mailbox priority. Lower ordinal is processed first; arrival order decides within a level.
 */
public enum EventPriority {
    EMERGENCY,
    NORMAL
}

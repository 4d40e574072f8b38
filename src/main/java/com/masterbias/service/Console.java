package com.masterbias.service;

/**
 * Leveled progress channel. {@code levelChange} is applied after the message is emitted, so
 * {@code message("Processing group", +1)} indents whatever follows it.
 */
public interface Console {

    void message(String text, int levelChange);

    /** Remember the current level so a later {@link #popLevel()} can return to it. */
    void pushLevel();

    void popLevel();
}

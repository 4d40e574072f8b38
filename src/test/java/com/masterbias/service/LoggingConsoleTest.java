package com.masterbias.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConsoleTest {

    @Test
    void testLevelChangeAppliesAfterMessage() {
        LoggingConsole console = new LoggingConsole();
        console.message("top", +1);
        assertEquals(1, console.currentLevel());
        console.message("nested", +1);
        console.message("back", -1);
        assertEquals(1, console.currentLevel());
    }

    @Test
    void testPushAndPopRestoreLevel() {
        LoggingConsole console = new LoggingConsole();
        console.message("a", +1);
        console.pushLevel();
        console.message("b", +2);
        console.pushLevel();
        console.message("c", +1);
        assertEquals(4, console.currentLevel());

        console.popLevel();
        assertEquals(3, console.currentLevel());
        console.popLevel();
        assertEquals(1, console.currentLevel());
        // Sin niveles guardados no cambia nada
        console.popLevel();
        assertEquals(1, console.currentLevel());
    }

    @Test
    void testLevelNeverGoesNegative() {
        LoggingConsole console = new LoggingConsole();
        console.message("x", -3);
        assertEquals(0, console.currentLevel());
    }
}

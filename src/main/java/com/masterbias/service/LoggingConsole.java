package com.masterbias.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

public class LoggingConsole implements Console {
    private static final Logger logger = LoggerFactory.getLogger(LoggingConsole.class);

    private final Deque<Integer> savedLevels = new ArrayDeque<>();
    private int level = 0;

    @Override
    public synchronized void message(String text, int levelChange) {
        logger.info("{}{}", "  ".repeat(level), text);
        level = Math.max(0, level + levelChange);
    }

    @Override
    public synchronized void pushLevel() {
        savedLevels.push(level);
    }

    @Override
    public synchronized void popLevel() {
        if (!savedLevels.isEmpty()) level = savedLevels.pop();
    }

    synchronized int currentLevel() {
        return level;
    }
}

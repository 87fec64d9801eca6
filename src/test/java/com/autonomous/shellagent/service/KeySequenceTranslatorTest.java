package com.autonomous.shellagent.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeySequenceTranslatorTest {

    private final KeySequenceTranslator translator = new KeySequenceTranslator();

    @Test
    void shouldTranslateNamedKeys() {
        assertEquals("y\r", translator.translate(List.of("y", "enter")));
        assertEquals("\t \u001b", translator.translate(List.of("TAB", "space", "esc")));
        assertEquals("\u001b[A\u001b[B", translator.translate(List.of("up", "down")));
    }

    @Test
    void shouldCombineModifierWithNextKey() {
        assertEquals("\u0003", translator.translate(List.of("ctrl", "c")));
        assertEquals("\u0004", translator.translate(List.of("ctrl+d")));
        assertEquals("\u001bx", translator.translate(List.of("alt", "x")));
    }

    @Test
    void shouldPassUnknownTokensThrough() {
        assertEquals("git status", translator.translate(List.of("git status")));
        assertEquals("ctrlhello", translator.translate(List.of("ctrl", "hello")));
        assertEquals("ctrl", translator.translate(List.of("ctrl")));
    }
}

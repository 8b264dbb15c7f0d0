package com.example.anchormud;

import com.example.anchormud.net.CommandParser;
import com.example.anchormud.net.CommandParser.Command;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandParser Tests")
public class CommandParserTest {

    @Test
    @DisplayName("parse returns command with correct name for 'look'")
    void parseLook() {
        Command c = CommandParser.parse("look");
        assertNotNull(c);
        assertEquals("look", c.getName());
        assertEquals("", c.getArgs());
    }

    @Test
    @DisplayName("parse splits the maneuver name from its target")
    void parseManeuverWithTarget() {
        Command c = CommandParser.parse("maneuver   heavy-blow   rat ");
        assertNotNull(c);
        assertEquals("maneuver", c.getName());
        assertEquals("heavy-blow   rat", c.getArgs());
        assertEquals("heavy-blow", c.firstArg());
        assertEquals("rat", c.restArgs());
    }

    @Test
    void parseFirstArgWithoutRest() {
        Command c = CommandParser.parse("ready riposte");
        assertEquals("riposte", c.firstArg());
        assertEquals("", c.restArgs());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    @DisplayName("parse returns null for blank input")
    void parseBlankReturnsNull(String input) {
        assertNull(CommandParser.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"unknowncommand", "xyz123", "say hello"})
    @DisplayName("parse returns null for unknown command")
    void parseUnknownCommandReturnsNull(String input) {
        assertNull(CommandParser.parse(input));
    }

    @ParameterizedTest
    @CsvSource({
        "l, look",
        "lo, look",
        "LOOK, look",
        "g, get",
        "take, get",
        "u, up",
        "d, down",
        "dow, down",
        "fl, disengage",
        "jo, join",
        "adv, advance",
        "ret, retreat",
        "int, interact"
    })
    @DisplayName("parse resolves names, aliases and prefixes")
    void parsePrefixMatching(String input, String expected) {
        Command c = CommandParser.parse(input);
        assertNotNull(c, "Command should not be null for input: " + input);
        assertEquals(expected, c.getName());
    }
}

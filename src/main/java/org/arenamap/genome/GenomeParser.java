package org.arenamap.genome;

import org.arenamap.config.AnalyzerConfig;
import org.arenamap.world.Room;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes an AB genome line:
 * {@code <x,y,size><x,y,size>...|<x,y,len><x,y,len>...}
 *
 * <p>Tokens before the bar are square rooms; tokens after it are corridors three tiles
 * wide, horizontal for a positive length and vertical otherwise.</p>
 */
public final class GenomeParser {
    private final String genome;
    private int pos;

    private GenomeParser(String genome) {
        this.genome = stripLineEnd(genome);
    }

    public static List<Room> parse(String genome) {
        if (genome == null) throw new IllegalArgumentException("genome is null");
        return new GenomeParser(genome).readAll();
    }

    private List<Room> readAll() {
        List<Room> rooms = new ArrayList<>();

        while (peek() == '<') {
            pos++;
            int x = readNumber(false);
            expect(',');
            int y = readNumber(false);
            expect(',');
            int size = readNumber(false);
            expect('>');
            rooms.add(Room.room(x, y, size));
        }

        if (peek() == '|') {
            pos++;
            while (peek() == '<') {
                pos++;
                int x = readNumber(false);
                expect(',');
                int y = readNumber(false);
                expect(',');
                int len = readNumber(true);
                expect('>');
                rooms.add(corridor(x, y, len));
            }
        }

        if (pos < genome.length()) {
            throw new GenomeParseException("Unexpected character '" + genome.charAt(pos) + "'", pos);
        }
        return rooms;
    }

    // Zero sizes and lengths end before their origin and are rejected by Room.
    private static Room corridor(int x, int y, int len) {
        int w = AnalyzerConfig.CORRIDOR_WIDTH;
        if (len > 0) return new Room(x, y, x + len - 1, y + w - 1, true);
        return new Room(x, y, x + w - 1, y - len - 1, true);
    }

    private int readNumber(boolean signed) {
        int start = pos;
        boolean negative = false;
        if (signed && peek() == '-') {
            negative = true;
            pos++;
        }
        int digitsStart = pos;
        long value = 0;
        while (pos < genome.length() && Character.isDigit(genome.charAt(pos))) {
            value = value * 10 + (genome.charAt(pos) - '0');
            if (value > Integer.MAX_VALUE) throw new GenomeParseException("Number too large", start);
            pos++;
        }
        if (pos == digitsStart) {
            if (pos >= genome.length()) throw new GenomeParseException("Unterminated token", pos);
            throw new GenomeParseException("Expected a digit but found '" + genome.charAt(pos) + "'", pos);
        }
        return (int) (negative ? -value : value);
    }

    private void expect(char c) {
        if (pos >= genome.length()) throw new GenomeParseException("Unterminated token, expected '" + c + "'", pos);
        if (genome.charAt(pos) != c) {
            throw new GenomeParseException("Expected '" + c + "' but found '" + genome.charAt(pos) + "'", pos);
        }
        pos++;
    }

    private char peek() {
        return pos < genome.length() ? genome.charAt(pos) : '\0';
    }

    private static String stripLineEnd(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }
}

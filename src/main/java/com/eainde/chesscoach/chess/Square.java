package com.eainde.chesscoach.chess;

import com.eainde.chesscoach.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Board coordinate. Indices follow the usual convention: a1 = 0, b1 = 1, ..., h8 = 63.
 */
public record Square(int index) {

    private static final Pattern NAME = Pattern.compile("^[a-h][1-8]$");

    public Square {
        if (index < 0 || index > 63) {
            throw new IllegalArgumentException("Square index out of range: " + index);
        }
    }

    public static Square of(int file, int rank) {
        return new Square(rank * 8 + file);
    }

    public static boolean isValid(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public static Square parse(String name) {
        if (!isValid(name)) {
            throw new ValidationException("Not a board square: '" + name + "' (expected file a-h and rank 1-8)");
        }
        return of(name.charAt(0) - 'a', name.charAt(1) - '1');
    }

    public int file() {
        return index & 7;
    }

    public int rank() {
        return index >> 3;
    }

    public String name() {
        return nameOf(index);
    }

    static String nameOf(int index) {
        return "" + (char) ('a' + (index & 7)) + (char) ('1' + (index >> 3));
    }

    @Override
    public String toString() {
        return name();
    }
}

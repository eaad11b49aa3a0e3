package com.modsearch.core.navigation;

import com.modsearch.core.error.ModSearchException;

import java.util.Set;

/**
 * Parsed form of the commands shared by the paged screens:
 * {@code q} (back), {@code <} and {@code >} (previous/next page), {@code p<N>} (jump to page N) and
 * a 1-based list index.
 */
public record NavigationCommand(Type type, int value) {

    public enum Type {
        QUIT,
        PREVIOUS_PAGE,
        NEXT_PAGE,
        GOTO_PAGE,   // value = 0-based page index, not yet wrapped
        SELECT       // value = 0-based item index on the current page
    }

    private static final Set<String> QUIT_WORDS = Set.of("q", "quit", "exit");

    public static boolean isQuit(String input) {
        return input != null && QUIT_WORDS.contains(input.strip().toLowerCase());
    }

    public static NavigationCommand parse(String input) throws ModSearchException {
        String text = input == null ? "" : input.strip();
        if (isQuit(text)) return new NavigationCommand(Type.QUIT, 0);
        if (text.equals("<")) return new NavigationCommand(Type.PREVIOUS_PAGE, 0);
        if (text.equals(">")) return new NavigationCommand(Type.NEXT_PAGE, 0);

        if (text.length() > 1 && text.charAt(0) == 'p') {
            return new NavigationCommand(Type.GOTO_PAGE, parseNumber(text.substring(1), text) - 1);
        }
        return new NavigationCommand(Type.SELECT, parseNumber(text, text) - 1);
    }

    private static int parseNumber(String digits, String input) throws ModSearchException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw ModSearchException.userInput("Unrecognized command \"" + input + "\"");
        }
    }

    /**
     * The page this command leads to from {@code current}, wrapped into {@code [0, pageCount)}.
     */
    public int targetPage(int current, int pageCount) {
        return switch (type) {
            case PREVIOUS_PAGE -> Math.floorMod(current - 1, pageCount);
            case NEXT_PAGE -> Math.floorMod(current + 1, pageCount);
            case GOTO_PAGE -> Math.floorMod(value, pageCount);
            default -> current;
        };
    }

    public boolean isPaging() {
        return type == Type.PREVIOUS_PAGE || type == Type.NEXT_PAGE || type == Type.GOTO_PAGE;
    }
}

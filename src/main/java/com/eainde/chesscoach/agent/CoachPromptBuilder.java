package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.chess.GamePosition;
import com.eainde.chesscoach.chess.GameRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the coach prompt templates ({@code prompts/coach-system.txt},
 * {@code prompts/coach-user.txt}). Placeholders use {@code ${name}}.
 */
@Component
public class CoachPromptBuilder {

    static final String SYSTEM_TEMPLATE = "/prompts/coach-system.txt";
    static final String USER_TEMPLATE = "/prompts/coach-user.txt";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(\\w+)}");

    private final String systemTemplate;
    private final String userTemplate;

    public CoachPromptBuilder() {
        this(read(SYSTEM_TEMPLATE), read(USER_TEMPLATE));
    }

    CoachPromptBuilder(String systemTemplate, String userTemplate) {
        this.systemTemplate = systemTemplate;
        this.userTemplate = userTemplate;
    }

    public String systemPrompt(CoachRequest request) {
        String focus = request.focusAreas().isEmpty()
                ? ""
                : "\n- Pay special attention to: " + String.join(", ", request.focusAreas());
        return render(systemTemplate, Map.of(
                "userElo", String.valueOf(request.userElo()),
                "focusAreas", focus));
    }

    public String userPrompt(CoachRequest request) {
        GameRecord game = request.game();
        return render(userTemplate, Map.of(
                "white", game.tag("White", "Unknown"),
                "black", game.tag("Black", "Unknown"),
                "result", game.tag("Result", "*"),
                "moveCount", String.valueOf(game.moveCount()),
                "pgn", game.pgn().strip(),
                "positions", positionList(game),
                "userElo", String.valueOf(request.userElo())));
    }

    static String positionList(GameRecord game) {
        StringBuilder sb = new StringBuilder();
        for (GamePosition position : game.positions()) {
            if (position.ply() == 0) {
                sb.append("0. start: ").append(position.fenAfter()).append('\n');
                continue;
            }
            String dots = position.ply() % 2 == 1 ? "." : "...";
            sb.append(position.ply()).append(". ")
                    .append(position.moveNumber()).append(dots).append(position.san())
                    .append(": ").append(position.fenAfter()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    static String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            if (value == null) {
                throw new IllegalStateException("No value for prompt placeholder ${" + matcher.group(1) + "}");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String read(String resource) {
        try (InputStream in = CoachPromptBuilder.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template " + resource + " not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, e);
        }
    }
}

package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LessonPayloadParserTest {

    @Test
    void parse_shouldReadSnakeCaseFields() {
        List<LessonComment> comments = LessonPayloadParser.parse(LessonFixtures.validCommentsJson());

        assertThat(comments).hasSize(3);
        assertThat(comments).isEqualTo(LessonFixtures.validComments());
        assertThat(comments.get(1).question().correctAnswer()).isEqualTo("d5");
    }

    @Test
    void parse_shouldStripMarkdownFencesAndProse() {
        String answer = "Here is your lesson:\n```json\n" + LessonFixtures.validCommentsJson() + "```\nEnjoy!";

        assertThat(LessonPayloadParser.parse(answer)).hasSize(3);
    }

    @Test
    void parse_shouldTolerateTrailingCommasAndSingleQuotes() {
        String sloppy = "{'comments': [{'step_number': 1, 'position_fen': '" + LessonFixtures.START
                + "', 'text': 'Hi', 'annotations': [],},],}";

        List<LessonComment> comments = LessonPayloadParser.parse(sloppy);

        assertThat(comments).singleElement().extracting(LessonComment::text).isEqualTo("Hi");
    }

    @Test
    void parse_shouldAcceptColorsInAnyCase() {
        String json = "{\"comments\": [{\"step_number\": 1, \"position_fen\": \"" + LessonFixtures.START
                + "\", \"text\": \"x\", \"annotations\": [{\"type\": \"Circle\", \"color\": \"RED\", \"square\": \"e4\"}]}]}";

        BoardAnnotation annotation = LessonPayloadParser.parse(json).get(0).annotations().get(0);

        assertThat(annotation.type()).isEqualTo(AnnotationType.CIRCLE);
        assertThat(annotation.color()).isEqualTo(AnnotationColor.RED);
    }

    @Test
    void parse_shouldRejectUnknownColors() {
        String json = "{\"comments\": [{\"step_number\": 1, \"position_fen\": \"" + LessonFixtures.START
                + "\", \"text\": \"x\", \"annotations\": [{\"type\": \"circle\", \"color\": \"purple\", \"square\": \"e4\"}]}]}";

        assertThatThrownBy(() -> LessonPayloadParser.parse(json))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("purple");
    }

    @Test
    void parse_shouldRejectNullAnnotations() {
        String json = "{\"comments\": [{\"step_number\": 1, \"position_fen\": \"" + LessonFixtures.START
                + "\", \"text\": \"x\", \"annotations\": [null]}]}";

        assertThatThrownBy(() -> LessonPayloadParser.parse(json))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Lesson JSON could not be read");
    }

    @Test
    void parse_shouldRejectAnswersWithoutJson() {
        assertThatThrownBy(() -> LessonPayloadParser.parse("I could not build a lesson."))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no JSON object");
        assertThatThrownBy(() -> LessonPayloadParser.parse(""))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parse_shouldRequireTheCommentsArray() {
        assertThatThrownBy(() -> LessonPayloadParser.parse("{\"lesson\": []}"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'comments'");
    }

    @Test
    void extractJson_shouldKeepTheOutermostObject() {
        assertThat(LessonPayloadParser.extractJson("ok {\"a\": {\"b\": 1}} done")).isEqualTo("{\"a\": {\"b\": 1}}");
    }
}

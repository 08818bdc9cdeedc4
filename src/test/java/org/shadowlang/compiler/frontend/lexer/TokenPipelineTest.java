package org.shadowlang.compiler.frontend.lexer;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests the producer/consumer hand-over of the {@link TokenPipeline}.
 */
@Tag("unit")
class TokenPipelineTest {

    /**
     * The queue holds a single token: the producer blocks after the first one until the
     * consumer takes it.
     */
    @Test
    void producerKeepsAtMostOneTokenInFlight() {
        try (TokenPipeline pipeline = TokenPipeline.start(new Lexer("a = b + c"))) {
            await().atMost(Duration.ofSeconds(5)).until(() -> pipeline.pendingTokens() == 1);
            // Still blocked on the full queue, not finished.
            assertThat(pipeline.isRunning()).isTrue();
            assertThat(pipeline.pendingTokens()).isEqualTo(1);

            assertThat(pipeline.nextToken().text()).isEqualTo("a");
            await().atMost(Duration.ofSeconds(5)).until(() -> pipeline.pendingTokens() == 1);
            assertThat(pipeline.nextToken().text()).isEqualTo("=");
        }
    }

    @Test
    void deliversAllTokensInOrderAndEndsWithEndOfFile() {
        String source = "for i = 0; i < 3; i = i + 1 { x = x * 2 }";
        List<String> expected = new Lexer(source).scanTokens().stream().map(Token::text).toList();

        List<String> actual = new ArrayList<>();
        try (TokenPipeline pipeline = TokenPipeline.start(new Lexer(source))) {
            Token token;
            do {
                token = pipeline.nextToken();
                actual.add(token.text());
            } while (token.type() != TokenType.END_OF_FILE);

            assertThat(pipeline.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
            assertThat(pipeline.awaitLexicalError()).isEmpty();
            await().atMost(Duration.ofSeconds(5)).until(() -> !pipeline.isRunning());
        }
        assertThat(actual).isEqualTo(expected);
    }

    /**
     * The error travels on its own channel and is visible once END_OF_FILE was taken.
     */
    @Test
    void lexicalErrorIsPublishedBeforeEndOfFile() {
        try (TokenPipeline pipeline = TokenPipeline.start(new Lexer("a = 1 $ 2"))) {
            assertThat(pipeline.nextToken().text()).isEqualTo("a");
            assertThat(pipeline.nextToken().text()).isEqualTo("=");
            assertThat(pipeline.nextToken().text()).isEqualTo("1");
            assertThat(pipeline.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);

            assertThat(pipeline.awaitLexicalError()).map(Diagnostic::code)
                    .contains(CompilerErrorCode.UNRECOGNIZED_CHARACTER);
        }
    }

    /**
     * A consumer that stops early (as the parser does after an error) still releases the producer.
     */
    @Test
    void awaitLexicalErrorDrainsAnUnfinishedStream() {
        TokenPipeline pipeline = TokenPipeline.start(new Lexer("a b c d e f g h i j k ?"));
        pipeline.nextToken();

        assertThat(pipeline.awaitLexicalError()).isPresent();
        assertThat(pipeline.isRunning()).isFalse();
        pipeline.close();
    }

    @Test
    void closeReleasesABlockedProducer() {
        TokenPipeline pipeline = TokenPipeline.start(new Lexer("a b c d e f"));
        await().atMost(Duration.ofSeconds(5)).until(() -> pipeline.pendingTokens() == 1);

        pipeline.close();

        await().atMost(Duration.ofSeconds(5)).until(() -> !pipeline.isRunning());
    }
}

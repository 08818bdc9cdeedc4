package org.shadowlang.compiler.frontend.lexer;

import org.shadowlang.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a {@link Lexer} on its own producer thread and hands the tokens to a single consumer
 * (the parser) through a queue that holds exactly one token. The producer therefore blocks
 * until the previous token has been taken, which keeps at most one token in flight.
 * <p>
 * Two channels connect the threads: the token queue, which always ends with
 * {@link TokenType#END_OF_FILE} (also after a lexical error), and a one-slot error channel.
 * The error is published before the final END_OF_FILE, so a consumer that has seen
 * END_OF_FILE is guaranteed to see the error as well. Consumers must drain the queue to
 * END_OF_FILE, even after a parse failure, or the producer stays blocked on the full queue;
 * {@link #awaitLexicalError()} does that.
 */
public class TokenPipeline implements TokenSource, Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenPipeline.class);

    private final Lexer lexer;
    private final BlockingQueue<Token> tokens = new ArrayBlockingQueue<>(1);
    private final BlockingQueue<Diagnostic> errors = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Thread thread;
    private Token endOfFile;

    /**
     * Creates a pipeline for the given lexer. The producer thread is not started yet.
     * @param lexer The lexer to run on the producer thread.
     */
    public TokenPipeline(Lexer lexer) {
        this.lexer = lexer;
        this.thread = new Thread(this, "shadowc-lexer");
        this.thread.setDaemon(true);
    }

    /**
     * Creates and starts a pipeline.
     * @param lexer The lexer to run.
     * @return The running pipeline.
     */
    public static TokenPipeline start(Lexer lexer) {
        TokenPipeline pipeline = new TokenPipeline(lexer);
        pipeline.startProducer();
        return pipeline;
    }

    /**
     * Starts the producer thread. Calling it more than once has no effect.
     */
    public void startProducer() {
        if (running.compareAndSet(false, true)) {
            thread.start();
        }
    }

    @Override
    public void run() {
        try {
            Token token = lexer.nextToken();
            while (token.type() != TokenType.END_OF_FILE) {
                tokens.put(token);
                token = lexer.nextToken();
            }
            lexer.lexicalError().ifPresent(error -> {
                log.debug("Lexer stopped early: {}", error.message());
                errors.offer(error);
            });
            tokens.put(token);
        } catch (InterruptedException e) {
            log.debug("Lexer thread interrupted, token stream ends early.");
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
        }
    }

    /**
     * Takes the next token from the queue, blocking until the producer has delivered it.
     * Once END_OF_FILE was taken, it is returned again on every further call.
     * @return The next token.
     * @throws IllegalStateException if the consumer thread is interrupted while waiting.
     */
    @Override
    public Token nextToken() {
        if (endOfFile != null) {
            return endOfFile;
        }
        try {
            Token token = tokens.take();
            if (token.type() == TokenType.END_OF_FILE) {
                endOfFile = token;
            }
            return token;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the lexer.", e);
        }
    }

    /**
     * Consumes and discards tokens until END_OF_FILE, releasing a blocked producer.
     */
    public void drain() {
        while (endOfFile == null) {
            nextToken();
        }
    }

    /**
     * Drains the token queue, waits for the producer to finish and returns its error, if any.
     * @return The lexical error that ended the stream, or empty if lexing succeeded.
     * @throws IllegalStateException if interrupted while waiting for the producer.
     */
    public Optional<Diagnostic> awaitLexicalError() {
        drain();
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the lexer thread.", e);
        }
        return Optional.ofNullable(errors.peek());
    }

    /**
     * @return true while the producer thread is still delivering tokens.
     */
    boolean isRunning() {
        return running.get();
    }

    /**
     * Number of tokens currently waiting in the queue (0 or 1).
     * @return The queue size.
     */
    int pendingTokens() {
        return tokens.size();
    }

    @Override
    public void close() {
        if (thread.isAlive() || !tokens.isEmpty()) {
            drain();
        }
    }
}

package com.modsearch.core.console;

import com.modsearch.core.navigation.Navigator;
import com.modsearch.core.navigation.Screen;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Interactive loop: render the current screen, block on one line of input, hand it to the navigator.
 */
public final class ConsoleSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleSession.class);

    private final Terminal terminal;
    private final LineReader lineReader;
    private final ScreenRenderer renderer;

    public ConsoleSession() throws IOException {
        this.terminal = TerminalBuilder.builder().system(true).build();
        this.lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .build();
        this.renderer = new ScreenRenderer(terminal.writer(), terminal::getWidth);
    }

    public ScreenRenderer getRenderer() {
        return renderer;
    }

    public void run(Navigator navigator) {
        Screen screen = navigator.start();
        while (!(screen instanceof Screen.Quit)) {
            renderer.render(screen);
            String input;
            try {
                input = lineReader.readLine(renderer.prompt(screen));
            } catch (UserInterruptException e) {
                // Ctrl-C behaves like "q"
                input = "q";
            } catch (EndOfFileException e) {
                logger.info("End of input, leaving.");
                break;
            }
            Screen next = navigator.next(screen, input);
            logger.debug("{} + '{}' -> {}", screen.getClass().getSimpleName(), input, next.getClass().getSimpleName());
            screen = next;
        }
        terminal.writer().println("Bye.");
        terminal.flush();
    }

    @Override
    public void close() throws IOException {
        terminal.close();
    }
}

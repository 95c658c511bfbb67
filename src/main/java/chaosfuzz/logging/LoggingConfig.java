package chaosfuzz.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class LoggingConfig {

    public static final String ROOT_LOGGER = "chaosfuzz";

    /**
     * Resets JUL and sends everything under the {@code chaosfuzz} logger to
     * {@code <logDir>/chaosfuzz<timestamp>.log}.
     *
     * @return the path of the log file
     */
    public static Path setup(Path logDir, String timestamp, Level level) throws IOException {
        LogManager.getLogManager().reset();

        Files.createDirectories(logDir);
        Path logFile = logDir.resolve("chaosfuzz" + timestamp + ".log");
        FileHandler fileHandler = new FileHandler(logFile.toString(), true);
        fileHandler.setFormatter(new ThreadAwareFormatter());
        fileHandler.setLevel(level);

        // Configure the top-level package logger; children inherit the handler.
        Logger rootLogger = Logger.getLogger(ROOT_LOGGER);
        rootLogger.addHandler(fileHandler);
        rootLogger.setLevel(level);
        return logFile;
    }

    public static Logger getLogger(Class<?> clazz) {
        return Logger.getLogger(clazz.getName());
    }
}

class ThreadAwareFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%s] %s: %s%n",
                Thread.currentThread().getName(),
                record.getLevel(),
                formatMessage(record)));

        Throwable thrown = record.getThrown();
        if (thrown != null) {
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                thrown.printStackTrace(pw);
            }
            sb.append(sw);
        }
        return sb.toString();
    }
}

package com.rapidlayout.utils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class HierarchicalLogger {
    public static class CustomFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return record.getLevel() + ": " + record.getMessage() + "\n";
        }
    }

    private Logger logger;
    private int logHierDepth = 0;

    public HierarchicalLogger(String name) {
        logger = Logger.getLogger(name);
        logger.setUseParentHandlers(false);
    }

    public void setLevel(Level level) {
        logger.setLevel(level);
    }

    public Level getLevel() {
        return logger.getLevel();
    }

    public boolean isLoggable(Level level) {
        return logger.isLoggable(level);
    }

    public void setUseParentHandlers(boolean useParentHandlers) {
        logger.setUseParentHandlers(useParentHandlers);
    }

    public void addHandler(Handler handler) {
        logger.addHandler(handler);
    }

    public void removeAllHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    public void log(Level level, String msg) {
        if (!logger.isLoggable(level)) {
            return;
        }
        if (logHierDepth > 0) {
            msg = "#".repeat(logHierDepth) + " " + msg;
        }
        logger.log(level, msg);
    }

    public void severe(String msg) {
        this.log(Level.SEVERE, msg);
    }

    public void warning(String msg) {
        this.log(Level.WARNING, msg);
    }

    public void info(String msg) {
        this.log(Level.INFO, msg);
    }

    public void info(String msg, boolean autoIndent) {
        if (autoIndent) {
            int idx = msg.indexOf('\n');
            if (idx != -1 && idx != msg.length() - 1) {
                String firstLine = msg.substring(0, idx + 1);
                String rest = msg.substring(idx + 1);
                int indentNum = 7 + logHierDepth;

                msg = firstLine + insertAtHeadOfEachLine(" ".repeat(indentNum), rest);
            }
        }
        this.log(Level.INFO, msg);
    }

    public void config(String msg) {
        this.log(Level.CONFIG, msg);
    }

    public void fine(String msg) {
        this.log(Level.FINE, msg);
    }

    public void finer(String msg) {
        this.log(Level.FINER, msg);
    }

    public void newSubStep() {
        logHierDepth++;
    }

    public void endSubStep() {
        if (logHierDepth > 0) {
            logHierDepth--;
        }
    }

    public int getDepth() {
        return logHierDepth;
    }

    public void logHeader(Level level, String headerName) {
        int headerLen = 80;
        int headerNameLen = headerName.length();
        String separatorStr = "=".repeat(headerLen);
        int frontBlankSpace = Math.max(0, (headerLen - 4 - headerNameLen) / 2);
        int backBlankSpace = Math.max(0, headerLen - 4 - headerNameLen - frontBlankSpace);
        String nameStr = "==" + " ".repeat(frontBlankSpace) + headerName + " ".repeat(backBlankSpace) + "==";
        log(level, "");
        log(level, separatorStr);
        log(level, nameStr);
        log(level, separatorStr);
    }

    public void infoHeader(String name) {
        logHeader(Level.INFO, name);
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole, Level level) {
        HierarchicalLogger logger = new HierarchicalLogger(logName);
        // loggers are shared per name, drop handlers left by an earlier createLogger call
        logger.removeAllHandlers();

        if (logFilePath != null) {
            try {
                FileHandler fileHandler = new FileHandler(logFilePath.toString(), false);
                fileHandler.setFormatter(new CustomFormatter());
                fileHandler.setLevel(level);
                logger.addHandler(fileHandler);
            } catch (IOException e) {
                throw new IllegalArgumentException("Fail to open log file: " + logFilePath, e);
            }
        }

        if (enableConsole) {
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new CustomFormatter());
            consoleHandler.setLevel(level);
            logger.addHandler(consoleHandler);
        }
        logger.setLevel(level);

        return logger;
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole) {
        return createLogger(logName, logFilePath, enableConsole, Level.INFO);
    }

    public static HierarchicalLogger createPseudoLogger(String logName) {
        return createLogger(logName, null, false, Level.INFO);
    }

    public static String insertAtHeadOfEachLine(String head, String logInfo) {
        StringBuilder newLogInfo = new StringBuilder();
        int start = 0;
        int end;
        for (end = 0; end < logInfo.length(); end++) {
            if (logInfo.charAt(end) == '\n') {
                newLogInfo.append(head).append(logInfo, start, end + 1);
                start = end + 1;
            }
        }
        newLogInfo.append(head).append(logInfo, start, end);
        return newLogInfo.toString();
    }
}

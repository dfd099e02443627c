package org.sjsu.botworker.util;

import java.io.PrintWriter;
import java.io.StringWriter;

public class ExceptionUtil {

    private ExceptionUtil() {
    }

    /** Short form, e.g. {@code IllegalStateException('bot is on the wrong page')}. */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + "(" + (message == null ? "" : "'" + message + "'") + ")";
    }

    public static String stackTrace(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }
}

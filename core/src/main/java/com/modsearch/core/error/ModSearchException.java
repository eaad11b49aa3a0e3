package com.modsearch.core.error;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Checked failure raised by the query compiler, the gateway and the download procedure.
 * The navigator catches it at the nearest screen transition and shows an error screen.
 */
public class ModSearchException extends Exception {
    private final ErrorKind kind;
    private final String detail;

    public ModSearchException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ModSearchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause == null ? null : stackTraceOf(cause), cause);
    }

    private ModSearchException(ErrorKind kind, String message, String detail, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static ModSearchException userInput(String message) {
        return new ModSearchException(ErrorKind.USER_INPUT, message);
    }

    public static ModSearchException remote(String code, String description) {
        return new ModSearchException(ErrorKind.REMOTE_APPLICATION, code + ": " + description);
    }

    public static ModSearchException transport(String message, Throwable cause) {
        return new ModSearchException(ErrorKind.TRANSPORT, message, cause);
    }

    public static ModSearchException resource(String message, Throwable cause) {
        return new ModSearchException(ErrorKind.RESOURCE, message, cause);
    }

    public static ModSearchException internal(String message) {
        return new ModSearchException(ErrorKind.INTERNAL, message);
    }

    public static ModSearchException internal(String message, Throwable cause) {
        return new ModSearchException(ErrorKind.INTERNAL, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Full diagnostic text (stack trace) for transport and internal faults, or null.
     */
    public String getDetail() {
        return detail;
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}

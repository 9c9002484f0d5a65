package com.example.lawrag.util;

public class ExceptionHelper {

    public static String getTrace(Throwable ex) {
        StackTraceElement[] st = ex.getStackTrace();
        if (st != null && st.length > 0) {
            StackTraceElement e = st[0];
            return e.getClassName() + ":" + e.getLineNumber();
        }
        return null;
    }

    public static String messageOf(Throwable ex) {
        String msg = ex.getMessage();
        return msg == null || msg.isBlank() ? ex.getClass().getSimpleName() : msg;
    }
}

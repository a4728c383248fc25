package com.baykanat.insider.warehouse.domain.exception;

import java.util.List;

/** View yenilemesi başarısız; önceki içerik geçerli kalır, scheduler backoff ile tekrar dener. */
public class RefreshFailureException extends RuntimeException {

    private final List<String> viewNames;

    public RefreshFailureException(String viewName, Throwable cause) {
        super("Refresh of view '" + viewName + "' failed: " + rootMessage(cause), cause);
        this.viewNames = List.of(viewName);
    }

    public RefreshFailureException(List<String> viewNames, Throwable cause) {
        super("Refresh failed for views " + viewNames, cause);
        this.viewNames = List.copyOf(viewNames);
    }

    public List<String> getViewNames() {
        return viewNames;
    }

    private static String rootMessage(Throwable cause) {
        Throwable root = cause;
        while (root != null && root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root != null ? root.getMessage() : "unknown error";
    }
}

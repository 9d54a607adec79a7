package dev.reviewflow.controller;

/** Identity headers set by the gateway in front of the service. */
public final class ApiHeaders {
    public static final String USER_ID = "X-User-Id";
    public static final String WORKSPACE_ID = "X-Workspace-Id";

    private ApiHeaders() {
    }
}

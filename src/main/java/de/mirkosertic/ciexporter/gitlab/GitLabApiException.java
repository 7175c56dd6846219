package de.mirkosertic.ciexporter.gitlab;

import java.io.IOException;

/**
 * Non-successful response of the GitLab API.
 */
public class GitLabApiException extends IOException {

    private final int statusCode;

    public GitLabApiException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

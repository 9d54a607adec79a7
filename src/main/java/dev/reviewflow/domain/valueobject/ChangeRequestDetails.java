package dev.reviewflow.domain.valueobject;

/** Opaque document-version references and a summary for a change request. */
public record ChangeRequestDetails(String versionFromId, String versionToId, String summary) {
    public ChangeRequestDetails {
        TextLimits.requireWithin("versionFromId", versionFromId, TextLimits.IDENTIFIER);
        TextLimits.requireWithin("versionToId", versionToId, TextLimits.IDENTIFIER);
        TextLimits.requireWithin("summary", summary, TextLimits.LONG_TEXT);
    }

    public static ChangeRequestDetails none() {
        return new ChangeRequestDetails(null, null, null);
    }
}

package dev.reviewflow.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.reviewflow.domain.valueobject.ChangeRequestDetails;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeRequestRequest(String versionFromId, String versionToId, String summary) {

    public ChangeRequestDetails toDetails() {
        return new ChangeRequestDetails(versionFromId, versionToId, summary);
    }
}

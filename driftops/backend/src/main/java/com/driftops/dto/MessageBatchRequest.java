package com.driftops.dto;

import com.driftops.model.LabeledMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of the reference, live batch and held-out uploads.
 */
@Value
@Builder
@Jacksonized
public class MessageBatchRequest {

    @NotEmpty(message = "messages must not be empty")
    @Size(max = 50_000, message = "at most 50000 messages per request")
    List<@Valid LabeledMessageRequest> messages;

    public List<LabeledMessage> toMessages() {
        return messages.stream().map(LabeledMessageRequest::toMessage).toList();
    }
}

package com.driftops.dto;

import com.driftops.model.LabeledMessage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LabeledMessageRequest {

    @NotBlank(message = "text is required")
    @Size(max = 10_000, message = "text must be at most 10000 characters")
    String text;

    /** true = spam, false = ham, null = unlabelled. */
    Boolean spam;

    public LabeledMessage toMessage() {
        return new LabeledMessage(text, spam);
    }
}

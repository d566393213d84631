package ch.so.arp.docqa.chat;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for questions. {@code topK} and
 * {@code similarityThreshold} fall back to the configured defaults when absent.
 */
public record ChatRequest(
        @NotBlank String question,
        @Min(1) Integer topK,
        @DecimalMin("0.0") @DecimalMax("1.0") Double similarityThreshold) {

    public ChatRequest(String question) {
        this(question, null, null);
    }
}

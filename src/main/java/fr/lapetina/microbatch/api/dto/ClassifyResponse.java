package fr.lapetina.microbatch.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;

import java.time.Duration;

/**
 * Body of a {@code /classify} reply.
 *
 * Success carries the label, the echoed sentence, the confidence, the processing
 * time in seconds and the worker id; failure carries only {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"class", "sentence", "confidence", "processing_time", "worker_id", "error"})
public class ClassifyResponse {

    @JsonProperty("class")
    private String label;

    private String sentence;

    private Double confidence;

    @JsonProperty("processing_time")
    private Double processingTime;

    @JsonProperty("worker_id")
    private Integer workerId;

    private String error;

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public String getSentence() { return sentence; }
    public void setSentence(String sentence) { this.sentence = sentence; }

    public Double getConfidence() { return confidence; }
    public void setConfidence(Double confidence) { this.confidence = confidence; }

    public Double getProcessingTime() { return processingTime; }
    public void setProcessingTime(Double processingTime) { this.processingTime = processingTime; }

    public Integer getWorkerId() { return workerId; }
    public void setWorkerId(Integer workerId) { this.workerId = workerId; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    /**
     * Builds the success body. Processing time is rounded to four decimals of a second.
     */
    public static ClassifyResponse success(ClassificationResponse response, String sentence, Duration elapsed) {
        ClassifyResponse body = new ClassifyResponse();
        body.label = response.label().wireName();
        body.sentence = sentence;
        body.confidence = response.confidence();
        body.processingTime = roundSeconds(elapsed);
        body.workerId = response.workerId();
        return body;
    }

    public static ClassifyResponse error(String message) {
        ClassifyResponse body = new ClassifyResponse();
        body.error = message;
        return body;
    }

    static double roundSeconds(Duration elapsed) {
        return Math.round(elapsed.toNanos() / 100_000.0) / 10_000.0;
    }
}

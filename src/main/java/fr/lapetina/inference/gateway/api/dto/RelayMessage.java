package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message posted by an execution fabric to the streaming relay.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage {

    @JsonProperty("task_id")
    private String taskId;

    private String data;
    private String error;

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getData() { return data; }
    public void setData(String data) { this.data = data; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}

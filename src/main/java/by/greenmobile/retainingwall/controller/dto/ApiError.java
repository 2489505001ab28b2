package by.greenmobile.retainingwall.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {
    int status;
    String error;
    String message;
    List<String> details;
    @JsonProperty("request_id")
    String requestId;
}

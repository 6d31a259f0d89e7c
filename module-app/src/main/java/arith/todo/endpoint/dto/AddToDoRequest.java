package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AddToDoRequest(
    @JsonProperty("task") String task, @JsonProperty("status") boolean status) {}

package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteToDoResponse(@JsonProperty("taskID") @JsonAlias("taskId") String taskId) {}

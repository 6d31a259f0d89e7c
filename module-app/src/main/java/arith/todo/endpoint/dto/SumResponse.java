package arith.todo.endpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SumResponse(@JsonProperty("v") int v) {}
